package com.modeling.dae.util;

import com.modeling.dae.CompilationResult;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.ExpressionPrinter;
import com.modeling.dae.blt.BltOrderer;
import com.modeling.dae.blt.BltResult;
import com.modeling.dae.dae.Dae;

import java.util.*;

/**
 * Diagnostic dumps of a compiled model.
 *
 * <p>
 * Produces a plain-text listing of the variable buckets and equations, a
 * listing of the BLT blocks, and a Mermaid diagram of block dependencies for
 * embedding in Markdown. Allocates freely; not meant for hot paths.
 */
public final class DaeExplain {
    private final CompilationResult result;

    public DaeExplain(CompilationResult result) {
        this.result = result;
    }

    /** One-line summary: name, bucket sizes, balance status. */
    public String summary() {
        Dae dae = result.dae();
        return String.format("%s: x=%d y=%d z=%d m=%d u=%d p=%d cp=%d, fx=%d fz=%d fm=%d fc=%d; %s",
                dae.getName(), dae.getX().size(), dae.getY().size(), dae.getZ().size(), dae.getM().size(),
                dae.getU().size(), dae.getP().size(), dae.getCp().size(), dae.getFx().size(), dae.getFz().size(),
                dae.getFm().size(), dae.getFc().size(), result.balance().statusMessage());
    }

    /** Full listing of buckets and equation sets. */
    public String dumpDae() {
        Dae dae = result.dae();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Model ").append(dae.getName());
        if (!dae.getModelHash().isEmpty())
            sb.append(" [").append(dae.getModelHash(), 0, Math.min(12, dae.getModelHash().length())).append(']');
        sb.append('\n');
        bucket(sb, "p", dae.getP());
        bucket(sb, "cp", dae.getCp());
        bucket(sb, "x", dae.getX());
        bucket(sb, "y", dae.getY());
        bucket(sb, "z", dae.getZ());
        bucket(sb, "m", dae.getM());
        bucket(sb, "u", dae.getU());
        equations(sb, "fx", dae.getFx());
        equations(sb, "fz", dae.getFz());
        equations(sb, "fm", dae.getFm());
        if (!dae.getFc().isEmpty()) {
            sb.append("  fc:\n");
            dae.getFc().forEach((k, v) -> sb.append("    ").append(k).append(" := ")
                    .append(ExpressionPrinter.print(v)).append('\n'));
        }
        if (!dae.getFr().isEmpty()) {
            sb.append("  fr:\n");
            dae.getFr().forEach((k, v) -> v.forEach(st -> sb.append("    ").append(k).append(": ")
                    .append(ExpressionPrinter.print(st)).append('\n')));
        }
        return sb.toString();
    }

    /** BLT blocks in solve order; coupled blocks are marked. */
    public String dumpBlocks() {
        BltResult blt = result.blt();
        if (blt == null)
            return "No BLT ordering\n";
        StringBuilder sb = new StringBuilder(512);
        sb.append("Blocks (").append(blt.blocks().size()).append("):\n");
        int pos = 0;
        for (int b = 0; b < blt.blocks().size(); b++) {
            List<Integer> block = blt.blocks().get(b);
            sb.append("  [").append(b).append(']');
            if (block.size() > 1)
                sb.append(" LOOP");
            sb.append('\n');
            for (int i : block) {
                String solves = blt.matching().get(i);
                sb.append("    ").append(ExpressionPrinter.print(blt.equations().get(pos++)));
                if (solves != null)
                    sb.append("   -> ").append(solves);
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Mermaid graph of BLT blocks. An edge {@code B0 --> B1} means a variable
     * solved in block 0 is used by block 1.
     */
    public String toMermaid() {
        BltResult blt = result.blt();
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");
        if (blt == null)
            return sb.toString();

        List<Set<String>> solved = new ArrayList<>();
        List<Set<String>> used = new ArrayList<>();
        int pos = 0;
        for (int b = 0; b < blt.blocks().size(); b++) {
            List<Integer> block = blt.blocks().get(b);
            Set<String> s = new LinkedHashSet<>();
            Set<String> u = new LinkedHashSet<>();
            StringBuilder label = new StringBuilder();
            for (int i : block) {
                Equation eq = blt.equations().get(pos++);
                String v = blt.matching().get(i);
                if (v != null)
                    s.add(v);
                if (eq instanceof Equation.Simple simple) {
                    u.addAll(BltOrderer.variablesOf(simple.lhs()));
                    u.addAll(BltOrderer.variablesOf(simple.rhs()));
                }
                if (label.length() > 0)
                    label.append("<br/>");
                label.append(escape(ExpressionPrinter.print(eq)));
            }
            u.removeAll(s);
            solved.add(s);
            used.add(u);
            sb.append("  B").append(b).append("[\"").append(label).append("\"];\n");
        }
        for (int from = 0; from < solved.size(); from++) {
            for (int to = 0; to < used.size(); to++) {
                if (from != to && !Collections.disjoint(solved.get(from), used.get(to)))
                    sb.append("  B").append(from).append(" --> B").append(to).append(";\n");
            }
        }
        return sb.toString();
    }

    private static void bucket(StringBuilder sb, String label, Map<String, Component> vars) {
        if (vars.isEmpty())
            return;
        sb.append("  ").append(label).append(": ").append(String.join(", ", vars.keySet())).append('\n');
    }

    private static void equations(StringBuilder sb, String label, List<Equation> eqs) {
        if (eqs.isEmpty())
            return;
        sb.append("  ").append(label).append(":\n");
        for (Equation eq : eqs)
            sb.append("    ").append(ExpressionPrinter.print(eq)).append('\n');
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
