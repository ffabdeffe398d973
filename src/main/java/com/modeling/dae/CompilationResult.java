package com.modeling.dae;

import com.modeling.dae.api.Stage;
import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.balance.BalanceCheckResult;
import com.modeling.dae.blt.BltResult;
import com.modeling.dae.dae.Dae;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything one pipeline run produced.
 *
 * @param flatClass the flattened root
 * @param dae       the assembled system, {@code fx} in BLT order when ordering
 *                  is enabled
 * @param blt       ordering details, null when ordering is disabled
 * @param balance   equation/unknown count of {@code dae}
 * @param modelHash SHA-256 of the canonical class table, hex encoded
 * @param timings   wall time per stage in nanoseconds
 */
public record CompilationResult(ClassDefinition flatClass, Dae dae, BltResult blt, BalanceCheckResult balance,
        String modelHash, Map<Stage, Long> timings) {

    public CompilationResult {
        EnumMap<Stage, Long> copy = new EnumMap<>(Stage.class);
        copy.putAll(timings);
        timings = Collections.unmodifiableMap(copy);
    }

    public String name() {
        return dae.getName();
    }

    public long totalNanos() {
        return timings.values().stream().mapToLong(Long::longValue).sum();
    }
}
