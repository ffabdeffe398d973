package com.modeling.dae.blt;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Maximum bipartite matching of equations (left) to variables (right),
 * O(E * sqrt(V)).
 * <p>
 * {@code adjacency[eq]} lists the variable indices equation {@code eq} may be
 * solved for, in preference order.
 */
public final class HopcroftKarpMatcher {
    public static final int UNMATCHED = -1;
    private static final int INF = Integer.MAX_VALUE;

    private final int[][] adjacency;
    private final int[] pairLeft;
    private final int[] pairRight;
    private final int[] dist;

    public HopcroftKarpMatcher(int variableCount, int[][] adjacency) {
        this.adjacency = adjacency;
        this.pairLeft = new int[adjacency.length];
        this.pairRight = new int[variableCount];
        this.dist = new int[adjacency.length];
        Arrays.fill(pairLeft, UNMATCHED);
        Arrays.fill(pairRight, UNMATCHED);
    }

    /** Runs the matching and returns its size. */
    public int match() {
        int size = 0;
        while (bfs()) {
            for (int eq = 0; eq < adjacency.length; eq++)
                if (pairLeft[eq] == UNMATCHED && dfs(eq))
                    size++;
        }
        return size;
    }

    /** Variable matched to {@code eq}, or {@link #UNMATCHED}. */
    public int variableOf(int eq) {
        return pairLeft[eq];
    }

    /** Equation matched to {@code var}, or {@link #UNMATCHED}. */
    public int equationOf(int var) {
        return pairRight[var];
    }

    private boolean bfs() {
        Deque<Integer> queue = new ArrayDeque<>();
        for (int eq = 0; eq < adjacency.length; eq++) {
            if (pairLeft[eq] == UNMATCHED) {
                dist[eq] = 0;
                queue.add(eq);
            } else {
                dist[eq] = INF;
            }
        }
        boolean foundFree = false;
        while (!queue.isEmpty()) {
            int eq = queue.poll();
            for (int var : adjacency[eq]) {
                int next = pairRight[var];
                if (next == UNMATCHED) {
                    foundFree = true;
                } else if (dist[next] == INF) {
                    dist[next] = dist[eq] + 1;
                    queue.add(next);
                }
            }
        }
        return foundFree;
    }

    private boolean dfs(int eq) {
        for (int var : adjacency[eq]) {
            int next = pairRight[var];
            if (next == UNMATCHED || (dist[next] == dist[eq] + 1 && dfs(next))) {
                pairLeft[eq] = var;
                pairRight[var] = eq;
                return true;
            }
        }
        dist[eq] = INF;
        return false;
    }
}
