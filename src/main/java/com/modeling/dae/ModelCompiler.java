package com.modeling.dae;

import com.modeling.dae.api.CompilationListener;
import com.modeling.dae.api.Stage;
import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.balance.BalanceCheckResult;
import com.modeling.dae.balance.BalanceChecker;
import com.modeling.dae.blt.BltOrderer;
import com.modeling.dae.blt.BltResult;
import com.modeling.dae.dae.Dae;
import com.modeling.dae.dae.DaeCreator;
import com.modeling.dae.flatten.Flattener;
import com.modeling.dae.io.ClassTableLoader;
import com.modeling.dae.io.DefinitionException;
import com.modeling.dae.util.CompositeCompilationListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.function.Supplier;

/**
 * Runs the full pipeline for one root class:
 * flatten, assemble the DAE, order its continuous equations, check balance.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading class tables from JSON files or classpath resources</li>
 * <li>Wiring each stage from one {@link CompilerOptions}</li>
 * <li>Stage timing and {@link CompilationListener} notification</li>
 * <li>Stamping the DAE with the model hash and library version</li>
 * </ul>
 * A compiler holds no per-run state and can be shared between threads.
 */
public final class ModelCompiler {
    private static final Logger log = LogManager.getLogger(ModelCompiler.class);

    public static final String VERSION = "0.1.0";

    private final CompilerOptions options;
    private final Flattener flattener;
    private final DaeCreator daeCreator;
    private final BltOrderer orderer;
    private final BalanceChecker balanceChecker;
    private final CompositeCompilationListener listeners = new CompositeCompilationListener();

    public ModelCompiler() {
        this(CompilerOptions.DEFAULT);
    }

    public ModelCompiler(CompilerOptions options) {
        this.options = options;
        this.flattener = new Flattener(options.getReservedIdentifiers(), options.getExtendsPolicy());
        this.daeCreator = new DaeCreator(options.getReservedIdentifiers(), options.isDiscreteRealsInZ());
        this.orderer = new BltOrderer(options.isMatchImplicitEquations(), options.isNormalizeDerivativeCoefficients());
        this.balanceChecker = new BalanceChecker(options.getForCountingPolicy());
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Registers a listener. Listeners are added to a composite, never replaced.
     */
    public ModelCompiler addListener(CompilationListener listener) {
        listeners.addForComposite(listener);
        return this;
    }

    /**
     * Compiles a root class from a JSON class table file.
     *
     * @throws DefinitionException if the file cannot be read or decoded
     */
    public CompilationResult compile(Path jsonPath, String rootName) {
        Map<String, ClassDefinition> table;
        try {
            table = ClassTableLoader.loadFile(jsonPath);
        } catch (IOException e) {
            throw new DefinitionException(jsonPath.toString(), "Failed to load class table", e);
        }
        return compile(table, rootName);
    }

    /** Compiles a root class from a JSON class table on the classpath. */
    public CompilationResult compileResource(String resource, String rootName) {
        return compile(ClassTableLoader.loadResource(resource), rootName);
    }

    /**
     * Compiles {@code rootName}; a null root selects the first class of the
     * table.
     *
     * @throws ModelCompilationException on flattening or assembly errors; an
     *                                   unbalanced model is reported in the
     *                                   result, not thrown
     */
    public CompilationResult compile(Map<String, ClassDefinition> classTable, String rootName) {
        String model = rootName != null ? rootName
                : classTable.isEmpty() ? "<empty>" : classTable.keySet().iterator().next();
        EnumMap<Stage, Long> timings = new EnumMap<>(Stage.class);

        ClassDefinition flat = timed(model, Stage.FLATTEN, timings, () -> flattener.flatten(classTable, rootName));
        Dae assembled = timed(model, Stage.ASSEMBLE, timings, () -> daeCreator.create(flat));

        BltResult blt = null;
        Dae dae = assembled;
        if (options.isOrderEquations()) {
            blt = timed(model, Stage.ORDER, timings, () -> orderer.order(assembled.getFx(), excludedFromMatching(assembled)));
            dae = assembled.withFx(blt.equations());
        }
        String hash = modelHash(model, classTable);
        dae.setModelHash(hash);
        dae.setVersion(VERSION);

        Dae finalDae = dae;
        BalanceCheckResult balance = timed(model, Stage.BALANCE, timings, () -> balanceChecker.checkDaeBalance(finalDae));
        if (!balance.balanced())
            log.warn("{}: {}", model, balance.statusMessage());

        CompilationResult result = new CompilationResult(flat, dae, blt, balance, hash, timings);
        log.info("Compiled {} in {} us: {}", model, result.totalNanos() / 1000, balance.statusMessage());
        listeners.onCompiled(model, result);
        return result;
    }

    /** Flattens and checks the flat class without assembling a DAE. */
    public BalanceCheckResult checkClassBalance(Map<String, ClassDefinition> classTable, String rootName) {
        return balanceChecker.checkClassBalance(flattener.flatten(classTable, rootName));
    }

    private <T> T timed(String model, Stage stage, Map<Stage, Long> timings, Supplier<T> work) {
        long start = System.nanoTime();
        T out;
        try {
            out = work.get();
        } catch (RuntimeException e) {
            log.error("{} failed during {}: {}", model, stage, e.getMessage());
            listeners.onFailed(model, stage, e);
            throw e;
        }
        long nanos = System.nanoTime() - start;
        timings.put(stage, nanos);
        log.debug("{} {} took {} us", model, stage, nanos / 1000);
        listeners.onStageComplete(model, stage, nanos);
        return out;
    }

    /** Parameters, constants and time never become an equation's matched variable. */
    private static Set<String> excludedFromMatching(Dae dae) {
        Set<String> excluded = new HashSet<>(dae.getP().keySet());
        excluded.addAll(dae.getCp().keySet());
        excluded.add("time");
        return excluded;
    }

    static String modelHash(String model, Map<String, ClassDefinition> classTable) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(ClassTableLoader.toJson(model, classTable).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
