package com.modeling.dae.blt;

import com.modeling.dae.ast.Equation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link BltOrderer#order}.
 *
 * @param equations        ordered and canonicalized equations
 * @param blocks           input indices per block, in output order; blocks
 *                         partition the input
 * @param matching         input index to the variable that equation solves for,
 *                         sorted by index
 * @param completeMatching true when every equation got a defining variable
 */
public record BltResult(List<Equation> equations, List<List<Integer>> blocks, Map<Integer, String> matching,
        boolean completeMatching) {

    public BltResult {
        equations = List.copyOf(equations);
        blocks = blocks.stream().map(List::copyOf).toList();
        matching = Collections.unmodifiableMap(new TreeMap<>(matching));
    }

    /** Blocks of more than one equation, i.e. coupled systems. */
    public List<List<Integer>> algebraicLoops() {
        return blocks.stream().filter(b -> b.size() > 1).toList();
    }
}
