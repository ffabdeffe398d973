package com.modeling.dae.blt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tarjan's strongly connected components, one depth-first pass, O(V + E).
 *
 * <p>
 * The DFS runs on an explicit frame stack, so deep dependency chains cannot
 * overflow the Java call stack. Roots are tried in index order and successors
 * in {@link EquationGraph} order, which fixes the output for a given graph.
 */
public final class TarjanScc {
    private TarjanScc() {
        // Utility class
    }

    /**
     * Returns the components in the order Tarjan completes them: every
     * component comes after all components reachable from it (reverse
     * topological order). Members of each component are sorted ascending.
     */
    public static List<int[]> compute(EquationGraph graph) {
        int n = graph.nodeCount();
        int[] index = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        int[] sccStack = new int[n];
        int sccTop = 0;
        int[] frameNode = new int[n];
        int[] framePos = new int[n];
        int counter = 0;
        List<int[]> result = new ArrayList<>();

        for (int root = 0; root < n; root++) {
            if (index[root] != -1)
                continue;
            int top = 0;
            frameNode[0] = root;
            framePos[0] = graph.successorsStart(root);
            index[root] = low[root] = counter++;
            sccStack[sccTop++] = root;
            onStack[root] = true;

            while (top >= 0) {
                int v = frameNode[top];
                if (framePos[top] < graph.successorsEnd(v)) {
                    int w = graph.targetAt(framePos[top]++);
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        sccStack[sccTop++] = w;
                        onStack[w] = true;
                        top++;
                        frameNode[top] = w;
                        framePos[top] = graph.successorsStart(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                // all successors done: v closes a component if it is its root
                if (low[v] == index[v]) {
                    int start = sccTop;
                    do {
                        start--;
                    } while (sccStack[start] != v);
                    int[] scc = Arrays.copyOfRange(sccStack, start, sccTop);
                    for (int w : scc)
                        onStack[w] = false;
                    sccTop = start;
                    Arrays.sort(scc);
                    result.add(scc);
                }
                top--;
                if (top >= 0) {
                    int parent = frameNode[top];
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }
        return result;
    }
}
