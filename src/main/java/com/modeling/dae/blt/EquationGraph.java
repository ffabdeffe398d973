package com.modeling.dae.blt;

import java.util.*;

/**
 * Immutable dependency graph over equation indices, CSR encoded.
 *
 * <p>
 * An edge {@code j -> i} means equation {@code j} defines a variable that
 * equation {@code i} uses, so {@code j} must be solved first.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>{@code offsets}: {@code offsets[v]} is where node {@code v}'s successors
 * start in {@code targets}; {@code offsets[v + 1]} is where they end.</li>
 * <li>{@code targets}: all successor lists, concatenated.</li>
 * </ul>
 * Successors keep the order in which edges were added, which is what makes the
 * SCC traversal, and therefore the equation ordering, reproducible.
 */
public final class EquationGraph {
    private final int[] offsets;
    private final int[] targets;
    private final int[] inDegree;

    private EquationGraph(int[] offsets, int[] targets, int[] inDegree) {
        this.offsets = offsets;
        this.targets = targets;
        this.inDegree = inDegree;
    }

    public int nodeCount() {
        return offsets.length - 1;
    }

    public int edgeCount() {
        return targets.length;
    }

    public int successorCount(int v) {
        return offsets[v + 1] - offsets[v];
    }

    public int successor(int v, int i) {
        return targets[offsets[v] + i];
    }

    public int successorsStart(int v) {
        return offsets[v];
    }

    public int successorsEnd(int v) {
        return offsets[v + 1];
    }

    public int targetAt(int flatIndex) {
        return targets[flatIndex];
    }

    public int predecessorCount(int v) {
        return inDegree[v];
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    /**
     * Collects edges in insertion order. Duplicate edges are ignored and
     * self-edges rejected.
     */
    public static final class Builder {
        private final List<LinkedHashSet<Integer>> edges;

        private Builder(int nodeCount) {
            if (nodeCount < 0)
                throw new IllegalArgumentException("Negative node count: " + nodeCount);
            edges = new ArrayList<>(nodeCount);
            for (int i = 0; i < nodeCount; i++)
                edges.add(new LinkedHashSet<>());
        }

        public Builder addEdge(int from, int to) {
            requireNode(from);
            requireNode(to);
            if (from == to)
                throw new IllegalArgumentException("Self-edge not allowed: " + from);
            edges.get(from).add(to);
            return this;
        }

        private void requireNode(int v) {
            if (v < 0 || v >= edges.size())
                throw new IllegalArgumentException("Unknown node: " + v);
        }

        public EquationGraph build() {
            int n = edges.size();
            int[] offsets = new int[n + 1];
            for (int v = 0; v < n; v++)
                offsets[v + 1] = offsets[v] + edges.get(v).size();

            int[] targets = new int[offsets[n]];
            int[] inDegree = new int[n];
            for (int v = 0; v < n; v++) {
                int pos = offsets[v];
                for (int w : edges.get(v)) {
                    targets[pos++] = w;
                    inDegree[w]++;
                }
            }
            return new EquationGraph(offsets, targets, inDegree);
        }
    }
}
