package com.modeling.dae.blt;

import com.modeling.dae.ast.BinaryOp;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.UnaryOp;
import com.modeling.dae.visitor.TreeWalker;
import com.modeling.dae.visitor.Visitor;

/**
 * Rewrites a simple equation so that a chosen variable stands alone on the
 * left side.
 *
 * <p>
 * Handled shapes, with {@code v} the variable and {@code e}, {@code k} free of
 * it:
 * <ul>
 * <li>{@code e = v} is swapped</li>
 * <li>sums and differences with {@code v} at coefficient +1 or -1, on either
 * side: {@code a + v = 0} gives {@code v = -a}, {@code a - v = b} gives
 * {@code v = a - b}</li>
 * <li>{@code k * v = e} or {@code v * k = e} gives {@code v = e / k}</li>
 * </ul>
 * Anything else, including a variable on both sides, is left alone.
 */
final class Causalizer {
    private Causalizer() {
    }

    /** {@code sign * v + rest}; a null rest stands for zero. */
    private record Term(int sign, Expression rest) {
    }

    /**
     * The equation solved for {@code variable}, or null when it already is or
     * the variable cannot be isolated.
     */
    static Equation.Simple solveFor(Equation.Simple s, String variable) {
        if (isVariable(s.lhs(), variable))
            return null;
        if (isVariable(s.rhs(), variable))
            return contains(s.lhs(), variable) ? null : s.swapped();

        Expression.ComponentRef target = findRef(s, variable);
        if (target == null)
            return null;

        Expression solved = null;
        if (isZero(s.rhs()))
            solved = solveAgainst(s.lhs(), null, variable);
        else if (isZero(s.lhs()))
            solved = solveAgainst(s.rhs(), null, variable);
        if (solved == null)
            solved = solveProduct(s.lhs(), s.rhs(), variable);
        if (solved == null)
            solved = solveProduct(s.rhs(), s.lhs(), variable);
        if (solved == null && !contains(s.rhs(), variable))
            solved = solveAgainst(s.lhs(), s.rhs(), variable);
        if (solved == null && !contains(s.lhs(), variable))
            solved = solveAgainst(s.rhs(), s.lhs(), variable);

        if (solved == null || contains(solved, variable))
            return null;
        return new Equation.Simple(target, solved);
    }

    /** Solves {@code side = other} where {@code side} is linear in the variable; null other is zero. */
    private static Expression solveAgainst(Expression side, Expression other, String variable) {
        Term t = linearTerm(side, variable);
        if (t == null)
            return null;
        Expression diff;
        if (other == null)
            diff = t.rest() == null ? zero() : negate(t.rest());
        else
            diff = t.rest() == null ? other : new Expression.Binary(BinaryOp.SUB, other, t.rest());
        return t.sign() > 0 || isZero(diff) ? diff : negate(diff);
    }

    private static Expression solveProduct(Expression side, Expression other, String variable) {
        if (!(side instanceof Expression.Binary b) || b.op() != BinaryOp.MUL || contains(other, variable))
            return null;
        if (isVariable(b.rhs(), variable) && !contains(b.lhs(), variable))
            return new Expression.Binary(BinaryOp.DIV, other, b.lhs());
        if (isVariable(b.lhs(), variable) && !contains(b.rhs(), variable))
            return new Expression.Binary(BinaryOp.DIV, other, b.rhs());
        return null;
    }

    /** Splits {@code e} into {@code ±v + rest}, or null if {@code v} is not a unit linear term of it. */
    private static Term linearTerm(Expression e, String variable) {
        if (isVariable(e, variable))
            return new Term(1, null);
        if (e instanceof Expression.Unary u && u.op() == UnaryOp.MINUS) {
            Term inner = linearTerm(u.operand(), variable);
            if (inner == null)
                return null;
            return new Term(-inner.sign(), inner.rest() == null ? null : negate(inner.rest()));
        }
        if (!(e instanceof Expression.Binary b))
            return null;
        if (b.op() == BinaryOp.ADD) {
            Term left = contains(b.rhs(), variable) ? null : linearTerm(b.lhs(), variable);
            if (left != null)
                return new Term(left.sign(), left.rest() == null ? b.rhs()
                        : new Expression.Binary(BinaryOp.ADD, left.rest(), b.rhs()));
            Term right = contains(b.lhs(), variable) ? null : linearTerm(b.rhs(), variable);
            if (right != null)
                return new Term(right.sign(), right.rest() == null ? b.lhs()
                        : new Expression.Binary(BinaryOp.ADD, b.lhs(), right.rest()));
            return null;
        }
        if (b.op() == BinaryOp.SUB) {
            Term left = contains(b.rhs(), variable) ? null : linearTerm(b.lhs(), variable);
            if (left != null)
                return new Term(left.sign(), left.rest() == null ? negate(b.rhs())
                        : new Expression.Binary(BinaryOp.SUB, left.rest(), b.rhs()));
            Term right = contains(b.lhs(), variable) ? null : linearTerm(b.rhs(), variable);
            if (right != null)
                return new Term(-right.sign(), right.rest() == null ? b.lhs()
                        : new Expression.Binary(BinaryOp.SUB, b.lhs(), right.rest()));
        }
        return null;
    }

    /** {@code -(-x)} is {@code x}, {@code -(a - b)} is {@code b - a}. */
    static Expression negate(Expression e) {
        if (e instanceof Expression.Unary u && u.op() == UnaryOp.MINUS)
            return u.operand();
        if (e instanceof Expression.Binary b && b.op() == BinaryOp.SUB)
            return new Expression.Binary(BinaryOp.SUB, b.rhs(), b.lhs());
        return new Expression.Unary(UnaryOp.MINUS, e);
    }

    static boolean isZero(Expression e) {
        if (!(e instanceof Expression.Literal lit))
            return false;
        if (lit.kind() != Expression.Literal.Kind.INTEGER && lit.kind() != Expression.Literal.Kind.REAL)
            return false;
        try {
            return Double.parseDouble(lit.text()) == 0.0;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static Expression zero() {
        return Expression.Literal.ofInt(0);
    }

    private static boolean isVariable(Expression e, String variable) {
        return e instanceof Expression.ComponentRef ref && ref.toString().equals(variable);
    }

    private static boolean contains(Expression e, String variable) {
        return BltOrderer.variablesOf(e).contains(variable);
    }

    private static Expression.ComponentRef findRef(Equation.Simple s, String variable) {
        Expression.ComponentRef[] found = new Expression.ComponentRef[1];
        Visitor finder = new Visitor() {
            @Override
            public void enterComponentRef(Expression.ComponentRef node) {
                if (found[0] == null && node.toString().equals(variable))
                    found[0] = node;
            }
        };
        TreeWalker.walk(s.lhs(), finder);
        TreeWalker.walk(s.rhs(), finder);
        return found[0];
    }
}
