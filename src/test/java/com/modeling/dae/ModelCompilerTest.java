package com.modeling.dae;

import com.modeling.dae.api.CompilationListener;
import com.modeling.dae.api.Stage;
import com.modeling.dae.ast.*;
import com.modeling.dae.flatten.CyclicExtendsException;
import com.modeling.dae.io.ClassTableLoader;
import com.modeling.dae.io.DefinitionException;
import org.junit.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ModelCompilerTest {

    private final ModelCompiler compiler = new ModelCompiler();

    private static List<String> printed(List<Equation> eqs) {
        return eqs.stream().map(ExpressionPrinter::print).toList();
    }

    @Test
    public void testIntegrator() {
        CompilationResult result = compiler.compileResource("/models/integrator.json", "Integrator");

        assertEquals("Integrator", result.name());
        assertEquals(List.of("x"), List.copyOf(result.dae().getX().keySet()));
        assertEquals(List.of("k"), List.copyOf(result.dae().getP().keySet()));
        assertEquals(List.of("der(x) = k"), printed(result.dae().getFx()));
        assertTrue(result.balance().balanced());
        assertEquals(1, result.balance().numStates());
        assertEquals(64, result.modelHash().length());
        assertEquals(result.modelHash(), result.dae().getModelHash());
        assertEquals(ModelCompiler.VERSION, result.dae().getVersion());
        assertEquals(4, result.timings().size());
    }

    @Test
    public void testBouncingBall() {
        CompilationResult result = compiler.compileResource("/models/bouncing_ball.json", null);

        assertEquals("BouncingBall", result.name());
        assertEquals(List.of("h", "v"), List.copyOf(result.dae().getX().keySet()));
        assertEquals("h < 0", ExpressionPrinter.print(result.dae().getFc().get("__c0")));
        assertEquals("v := -e * pre(v)", ExpressionPrinter.print(result.dae().getFr().get("__c0").get(0)));
        assertTrue(result.balance().balanced());
        // the when-equation is not part of the causal analysis and goes last
        assertTrue(result.dae().getFx().get(2) instanceof Equation.When);
    }

    @Test
    public void testRcCircuitIsFlattenedAndOrdered() {
        CompilationResult result = compiler.compileResource("/models/rc_circuit.json", "RC");

        assertEquals(List.of("r_R", "r_v", "r_i", "c_C", "c_v", "c_i"),
                List.copyOf(result.flatClass().getComponents().keySet()));
        assertEquals(List.of("c_v"), List.copyOf(result.dae().getX().keySet()));
        assertEquals(List.of("r_v", "r_i", "c_i"), List.copyOf(result.dae().getY().keySet()));
        assertEquals(List.of("r_R", "c_C"), List.copyOf(result.dae().getP().keySet()));
        assertEquals(List.of(
                "r_v = 10 - c_v",
                "r_i = r_v / r_R",
                "c_i = r_i",
                "der(c_v) = c_i / c_C"), printed(result.dae().getFx()));
        assertTrue(result.balance().balanced());
        assertEquals(4, result.balance().numUnknowns());
        assertTrue(result.blt().completeMatching());
    }

    @Test
    public void testUnbalancedModelsAreReportedNotThrown() {
        CompilationResult over = compiler.compileResource("/models/over_determined.json", "Over");
        assertFalse(over.balance().balanced());
        assertEquals(1, over.balance().difference());

        CompilationResult under = compiler.compileResource("/models/under_determined.json", "Under");
        assertEquals(-1, under.balance().difference());
    }

    @Test
    public void testOrderingCanBeDisabled() {
        ModelCompiler unordered = new ModelCompiler(CompilerOptions.builder().orderEquations(false).build());
        Map<String, ClassDefinition> table = ClassTableLoader.loadResource("/models/rc_circuit.json");

        CompilationResult result = unordered.compile(table, "RC");

        assertNull(result.blt());
        assertEquals(result.flatClass().getEquations(), result.dae().getFx());
        assertFalse(result.timings().containsKey(Stage.ORDER));
        assertTrue(result.balance().balanced());
    }

    @Test
    public void testModelHashIsStable() {
        Map<String, ClassDefinition> table = ClassTableLoader.loadResource("/models/integrator.json");
        String first = compiler.compile(table, "Integrator").modelHash();
        String again = compiler.compile(ClassTableLoader.loadResource("/models/integrator.json"), "Integrator")
                .modelHash();
        assertEquals(first, again);

        Map<String, ClassDefinition> changed = new LinkedHashMap<>(table);
        changed.put("Integrator", table.get("Integrator").toBuilder()
                .putComponent(Component.builder("k", "Real").variability(Variability.PARAMETER)
                        .start(Expression.num(3.0)).build())
                .build());
        assertNotEquals(first, compiler.compile(changed, "Integrator").modelHash());
    }

    @Test
    public void testListenersSeeStagesAndFailures() {
        List<String> events = new ArrayList<>();
        compiler.addListener(new CompilationListener() {
            @Override
            public void onStageComplete(String model, Stage stage, long durationNanos) {
                events.add(model + ":" + stage);
            }

            @Override
            public void onCompiled(String model, CompilationResult result) {
                events.add(model + ":done");
            }

            @Override
            public void onFailed(String model, Stage stage, Throwable error) {
                events.add(model + ":failed:" + stage);
            }
        });

        compiler.compileResource("/models/broken.json", "Good");
        try {
            compiler.compileResource("/models/broken.json", "LoopA");
            fail("Should detect the extends cycle");
        } catch (CyclicExtendsException expected) {
            // expected
        }

        assertEquals(List.of("Good:FLATTEN", "Good:ASSEMBLE", "Good:ORDER", "Good:BALANCE", "Good:done",
                "LoopA:failed:FLATTEN"), events);
    }

    @Test
    public void testMissingFile() {
        try {
            compiler.compile(Path.of("target", "no-such-model.json"), "M");
            fail("Should report unreadable file");
        } catch (DefinitionException e) {
            assertTrue(e.getLocation().contains("no-such-model.json"));
        }
    }

    @Test
    public void testCheckClassBalanceWithoutAssembly() {
        Map<String, ClassDefinition> table = ClassTableLoader.loadResource("/models/rc_circuit.json");
        assertTrue(compiler.checkClassBalance(table, "RC").balanced());
    }
}
