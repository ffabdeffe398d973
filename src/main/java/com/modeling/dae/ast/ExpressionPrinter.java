package com.modeling.dae.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders expressions, equations and statements back to infix source text.
 * Used for JSON export, diagnostics and log messages.
 */
public final class ExpressionPrinter {
    private ExpressionPrinter() {
        // Utility class
    }

    public static String print(Expression e) {
        if (e == null)
            return "";
        if (e instanceof Expression.Literal lit)
            return lit.toString();
        if (e instanceof Expression.ComponentRef ref)
            return ref.toString();
        if (e instanceof Expression.Unary u) {
            String operand = wrapIfBinary(u.operand());
            return u.op() == UnaryOp.NOT ? "not " + operand : u.op().symbol() + operand;
        }
        if (e instanceof Expression.Binary b) {
            String lhs = operand(b.lhs(), b.op(), false);
            String rhs = operand(b.rhs(), b.op(), true);
            return lhs + " " + b.op().symbol() + " " + rhs;
        }
        if (e instanceof Expression.FunctionCall c)
            return c.name() + "(" + join(c.args()) + ")";
        if (e instanceof Expression.ArrayLiteral a)
            return "{" + join(a.elements()) + "}";
        if (e instanceof Expression.Tuple t)
            return "(" + join(t.elements()) + ")";
        if (e instanceof Expression.Range r) {
            if (r.step() == null)
                return print(r.start()) + ":" + print(r.end());
            return print(r.start()) + ":" + print(r.step()) + ":" + print(r.end());
        }
        if (e instanceof Expression.Conditional c) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < c.branches().size(); i++) {
                Expression.Branch br = c.branches().get(i);
                sb.append(i == 0 ? "if " : " elseif ").append(print(br.condition()))
                        .append(" then ").append(print(br.value()));
            }
            return sb.append(" else ").append(print(c.elseValue())).toString();
        }
        throw new IllegalArgumentException("Unsupported expression: " + e.getClass().getSimpleName());
    }

    public static String print(Equation eq) {
        if (eq instanceof Equation.Simple s)
            return print(s.lhs()) + " = " + print(s.rhs());
        if (eq instanceof Equation.Connect c)
            return "connect(" + print(c.lhs()) + ", " + print(c.rhs()) + ")";
        if (eq instanceof Equation.FunctionCallEquation c)
            return c.name() + "(" + join(c.args()) + ")";
        if (eq instanceof Equation.For f) {
            String idx = f.indices().stream()
                    .map(i -> i.name() + " in " + print(i.range()))
                    .collect(Collectors.joining(", "));
            return "for " + idx + " loop " + printAll(f.equations()) + " end for";
        }
        if (eq instanceof Equation.When w)
            return blocks("when", "elsewhen", w.blocks()) + " end when";
        if (eq instanceof Equation.If i) {
            String text = blocks("if", "elseif", i.blocks());
            if (!i.elseEquations().isEmpty())
                text += " else " + printAll(i.elseEquations());
            return text + " end if";
        }
        throw new IllegalArgumentException("Unsupported equation: " + eq.getClass().getSimpleName());
    }

    public static String print(Statement st) {
        if (st instanceof Statement.Assignment a)
            return print(a.target()) + " := " + print(a.value());
        if (st instanceof Statement.CallStatement c)
            return c.name() + "(" + join(c.args()) + ")";
        if (st instanceof Statement.ForStatement f) {
            String idx = f.indices().stream()
                    .map(i -> i.name() + " in " + print(i.range()))
                    .collect(Collectors.joining(", "));
            return "for " + idx + " loop " + f.body().stream().map(ExpressionPrinter::print)
                    .collect(Collectors.joining("; ", "", ";")) + " end for";
        }
        if (st instanceof Statement.WhileStatement w)
            return "while " + print(w.condition()) + " loop " + w.body().stream().map(ExpressionPrinter::print)
                    .collect(Collectors.joining("; ", "", ";")) + " end while";
        if (st instanceof Statement.Return)
            return "return";
        if (st instanceof Statement.Break)
            return "break";
        throw new IllegalArgumentException("Unsupported statement: " + st.getClass().getSimpleName());
    }

    private static String blocks(String first, String next, List<Equation.EquationBlock> blocks) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < blocks.size(); i++) {
            Equation.EquationBlock b = blocks.get(i);
            if (i > 0)
                sb.append(' ');
            sb.append(i == 0 ? first : next).append(' ').append(print(b.condition()))
                    .append(" then ").append(printAll(b.equations()));
        }
        return sb.toString();
    }

    private static String printAll(List<Equation> eqs) {
        return eqs.stream().map(ExpressionPrinter::print).collect(Collectors.joining("; ", "", ";"));
    }

    private static String join(List<Expression> args) {
        return args.stream().map(ExpressionPrinter::print).collect(Collectors.joining(", "));
    }

    private static String wrapIfBinary(Expression e) {
        String s = print(e);
        return e instanceof Expression.Binary ? "(" + s + ")" : s;
    }

    private static String operand(Expression child, BinaryOp parent, boolean right) {
        String s = print(child);
        if (!(child instanceof Expression.Binary b))
            return s;
        int cp = precedence(b.op()), pp = precedence(parent);
        boolean nonAssociative = parent == BinaryOp.SUB || parent == BinaryOp.DIV || parent == BinaryOp.POW
                || parent == BinaryOp.ELEM_SUB || parent == BinaryOp.ELEM_DIV || parent == BinaryOp.ELEM_POW;
        if (cp < pp || (right && cp == pp && nonAssociative))
            return "(" + s + ")";
        return s;
    }

    private static int precedence(BinaryOp op) {
        return switch (op) {
            case OR -> 1;
            case AND -> 2;
            case EQ, NE, LT, LE, GT, GE -> 3;
            case ADD, SUB, ELEM_ADD, ELEM_SUB -> 4;
            case MUL, DIV, ELEM_MUL, ELEM_DIV -> 5;
            case POW, ELEM_POW -> 6;
        };
    }
}
