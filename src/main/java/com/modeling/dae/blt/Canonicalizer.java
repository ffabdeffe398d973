package com.modeling.dae.blt;

import com.modeling.dae.ast.BinaryOp;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.visitor.TreeWalker;
import com.modeling.dae.visitor.Visitor;

/** Rewrites derivative equations into {@code der(x) = f(...)} form. */
final class Canonicalizer {
    private Canonicalizer() {
    }

    static Equation canonicalize(Equation eq, boolean normalizeCoefficients) {
        if (!(eq instanceof Equation.Simple s))
            return eq;
        Equation.Simple out = s;
        if (!containsDer(s.lhs()) && containsDer(s.rhs()))
            out = s.swapped();
        if (normalizeCoefficients) {
            Equation.Simple n = normalizeCoefficient(out);
            if (n != null)
                out = n;
        }
        return out;
    }

    /** {@code c * der(x) = e} or {@code der(x) * c = e} becomes {@code der(x) = e / c}. */
    static Equation.Simple normalizeCoefficient(Equation.Simple s) {
        if (!(s.lhs() instanceof Expression.Binary b) || b.op() != BinaryOp.MUL)
            return null;
        if (isDerCall(b.rhs()))
            return new Equation.Simple(b.rhs(), new Expression.Binary(BinaryOp.DIV, s.rhs(), b.lhs()));
        if (isDerCall(b.lhs()))
            return new Equation.Simple(b.lhs(), new Expression.Binary(BinaryOp.DIV, s.rhs(), b.rhs()));
        return null;
    }

    /** The state argument of {@code der(x)}, or null if {@code e} is not such a call. */
    static Expression.ComponentRef derArgument(Expression e) {
        if (e instanceof Expression.FunctionCall c && c.isNamed("der") && c.args().size() == 1
                && c.args().get(0) instanceof Expression.ComponentRef ref)
            return ref;
        return null;
    }

    static boolean isDerCall(Expression e) {
        return derArgument(e) != null;
    }

    static boolean containsDer(Expression e) {
        boolean[] found = new boolean[1];
        TreeWalker.walk(e, new Visitor() {
            @Override
            public void enterExpression(Expression node) {
                if (node instanceof Expression.FunctionCall c && c.isNamed("der"))
                    found[0] = true;
            }
        });
        return found[0];
    }
}
