package com.modeling.dae.blt;

import com.modeling.dae.ast.BinaryOp;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.visitor.TreeWalker;
import com.modeling.dae.visitor.Visitor;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Orders equations into block lower triangular form.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>Each simple equation gets a defining variable from its left side: a bare
 * reference {@code v} defines {@code "v"}, {@code der(v)} (optionally scaled by
 * a coefficient) defines {@code "der(v)"}.</li>
 * <li>Simple equations of any other shape ({@code a + b = 0}) are matched to
 * one of their variables with Hopcroft-Karp, among variables no left side
 * already defines and outside the exclusion set. A matched equation is then
 * rearranged to {@code v = ...} when {@code v} occurs linearly (see
 * {@link Causalizer}); otherwise it stays implicit.</li>
 * <li>Edges run from the defining equation of {@code w} to every equation that
 * uses {@code w}; Tarjan groups the graph into blocks, which are reversed into
 * dependency order.</li>
 * <li>Equations that define nothing (if, when, for, connect, calls, unmatched
 * simple equations) are appended in input order, one block each.</li>
 * <li>Every other simple equation is canonicalized: derivative on the right only
 * means the sides are swapped, and {@code c * der(x) = e} becomes
 * {@code der(x) = e / c}.</li>
 * </ol>
 * Never throws on unusual shapes; they are left out of the analysis.
 */
public final class BltOrderer {
    private static final Logger log = LogManager.getLogger(BltOrderer.class);

    private final boolean matchImplicit;
    private final boolean normalizeCoefficients;

    public BltOrderer() {
        this(true, true);
    }

    public BltOrderer(boolean matchImplicit, boolean normalizeCoefficients) {
        this.matchImplicit = matchImplicit;
        this.normalizeCoefficients = normalizeCoefficients;
    }

    public BltResult order(List<Equation> equations) {
        return order(equations, Set.of());
    }

    /**
     * @param excluded variables never chosen by matching, typically parameters,
     *                 constants and {@code time}
     */
    public BltResult order(List<Equation> equations, Set<String> excluded) {
        int n = equations.size();
        String[] defines = new String[n];
        boolean[] matched = new boolean[n];
        List<Set<String>> uses = new ArrayList<>(n);
        Map<String, Integer> definedBy = new HashMap<>();

        for (int i = 0; i < n; i++) {
            Equation eq = equations.get(i);
            uses.add(Set.of());
            if (!(eq instanceof Equation.Simple s))
                continue;
            uses.set(i, variablesOf(s.rhs()));
            defines[i] = definingVariable(s.lhs());
            if (defines[i] != null)
                definedBy.put(defines[i], i);
        }

        if (matchImplicit)
            matchImplicit(equations, defines, matched, uses, definedBy, excluded);

        // graph over analyzable equations only; local index -> input index
        List<Integer> analyzable = new ArrayList<>();
        int[] local = new int[n];
        Arrays.fill(local, -1);
        for (int i = 0; i < n; i++) {
            if (defines[i] != null) {
                local[i] = analyzable.size();
                analyzable.add(i);
            }
        }

        EquationGraph.Builder graph = EquationGraph.builder(analyzable.size());
        for (int i : analyzable) {
            for (String var : uses.get(i)) {
                if (var.equals(defines[i]))
                    continue;
                Integer j = definedBy.get(var);
                if (j != null && j != i)
                    graph.addEdge(local[j], local[i]);
            }
        }
        List<int[]> sccs = TarjanScc.compute(graph.build());

        List<List<Integer>> blocks = new ArrayList<>();
        for (int k = sccs.size() - 1; k >= 0; k--) {
            List<Integer> block = new ArrayList<>();
            for (int v : sccs.get(k))
                block.add(analyzable.get(v));
            blocks.add(block);
        }
        for (int i = 0; i < n; i++)
            if (defines[i] == null)
                blocks.add(List.of(i));

        List<Equation> ordered = new ArrayList<>(n);
        Map<Integer, String> matching = new HashMap<>();
        for (List<Integer> block : blocks) {
            for (int i : block) {
                ordered.add(emit(equations.get(i), matched[i] ? defines[i] : null));
                if (defines[i] != null)
                    matching.put(i, defines[i]);
            }
        }

        BltResult result = new BltResult(ordered, blocks, matching, matching.size() == n);
        if (log.isDebugEnabled())
            log.debug("BLT: {} equations, {} blocks, {} algebraic loops, {} unmatched", n, blocks.size(),
                    result.algebraicLoops().size(), n - matching.size());
        return result;
    }

    private Equation emit(Equation eq, String matchedVariable) {
        if (matchedVariable != null && eq instanceof Equation.Simple s) {
            Equation.Simple solved = Causalizer.solveFor(s, matchedVariable);
            if (solved != null) {
                log.trace("Causalized {} for {}", s, matchedVariable);
                return solved;
            }
        }
        return Canonicalizer.canonicalize(eq, normalizeCoefficients);
    }

    /** {@code v}, {@code der(v)} or {@code c * der(v)}; null for any other shape. */
    public static String definingVariable(Expression lhs) {
        if (lhs instanceof Expression.ComponentRef ref)
            return ref.toString();
        Expression.ComponentRef state = Canonicalizer.derArgument(lhs);
        if (state != null)
            return "der(" + state + ")";
        if (lhs instanceof Expression.Binary b && b.op() == BinaryOp.MUL) {
            state = Canonicalizer.derArgument(b.lhs());
            if (state == null)
                state = Canonicalizer.derArgument(b.rhs());
            if (state != null)
                return "der(" + state + ")";
        }
        return null;
    }

    /**
     * Every variable referenced in {@code e}, in first-seen order. A reference
     * inside {@code der()} contributes both {@code "v"} and {@code "der(v)"}.
     */
    public static Set<String> variablesOf(Expression e) {
        Set<String> vars = new LinkedHashSet<>();
        TreeWalker.walk(e, new Visitor() {
            @Override
            public void enterExpression(Expression node) {
                Expression.ComponentRef state = Canonicalizer.derArgument(node);
                if (state != null)
                    vars.add("der(" + state + ")");
            }

            @Override
            public void enterComponentRef(Expression.ComponentRef node) {
                vars.add(node.toString());
            }
        });
        return vars;
    }

    private void matchImplicit(List<Equation> equations, String[] defines, boolean[] matched,
            List<Set<String>> uses, Map<String, Integer> definedBy, Set<String> excluded) {
        List<Integer> implicit = new ArrayList<>();
        List<Set<String>> candidates = new ArrayList<>();
        for (int i = 0; i < defines.length; i++) {
            if (defines[i] != null || !(equations.get(i) instanceof Equation.Simple s))
                continue;
            Set<String> all = variablesOf(s.lhs());
            all.addAll(uses.get(i));
            all.removeIf(v -> excluded.contains(v) || definedBy.containsKey(v));
            if (all.isEmpty())
                continue;
            implicit.add(i);
            candidates.add(all);
            // the equation also depends on whatever its left side mentions
            Set<String> u = new LinkedHashSet<>(variablesOf(s.lhs()));
            u.addAll(uses.get(i));
            uses.set(i, u);
        }
        if (implicit.isEmpty())
            return;

        // variables sorted by name so the matching does not depend on hash order
        List<String> variables = new ArrayList<>(new TreeSet<>(candidates.stream().flatMap(Set::stream).toList()));
        Map<String, Integer> varIndex = new HashMap<>();
        for (int v = 0; v < variables.size(); v++)
            varIndex.put(variables.get(v), v);

        int[][] adjacency = new int[implicit.size()][];
        for (int k = 0; k < implicit.size(); k++)
            adjacency[k] = candidates.get(k).stream().mapToInt(varIndex::get).toArray();

        HopcroftKarpMatcher matcher = new HopcroftKarpMatcher(variables.size(), adjacency);
        int matchedCount = matcher.match();
        for (int k = 0; k < implicit.size(); k++) {
            int v = matcher.variableOf(k);
            if (v == HopcroftKarpMatcher.UNMATCHED)
                continue;
            int i = implicit.get(k);
            defines[i] = variables.get(v);
            matched[i] = true;
            definedBy.put(defines[i], i);
        }
        log.debug("Matched {} of {} implicit equations", matchedCount, implicit.size());
    }
}
