package com.modeling.dae.balance;

import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Causality;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.UnaryOp;
import com.modeling.dae.dae.Dae;
import com.modeling.dae.dae.StateFinder;
import com.modeling.dae.visitor.TreeWalker;

import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Counts equations against unknowns for a flat class or an assembled DAE.
 *
 * <p>
 * Equation counting: simple and connect equations count one each; an
 * if-equation counts as its else branch, or its first branch when there is no
 * else; a for-equation counts its body per {@link ForCountingPolicy}; when- and
 * call-equations count zero.
 */
@Log4j2
public final class BalanceChecker {
    private final ForCountingPolicy forCounting;

    public BalanceChecker() {
        this(ForCountingPolicy.BODY_ONCE);
    }

    public BalanceChecker(ForCountingPolicy forCounting) {
        this.forCounting = forCounting;
    }

    /**
     * Unknowns are all components that are neither parameter/constant nor
     * input. States, found by scanning for {@code der()}, are a subset of them.
     */
    public BalanceCheckResult checkClassBalance(ClassDefinition cls) {
        Set<String> states = TreeWalker.walk(cls, new StateFinder()).states();
        int unknowns = 0, numStates = 0, parameters = 0, inputs = 0;
        for (Component c : cls.getComponents().values()) {
            if (c.variability().isFixed()) {
                parameters++;
            } else if (c.causality() == Causality.INPUT) {
                inputs++;
            } else {
                unknowns++;
                if (states.contains(c.name()))
                    numStates++;
            }
        }
        BalanceCheckResult result = BalanceCheckResult.of(countEquations(cls.getEquations()), unknowns, numStates,
                parameters, inputs);
        log.debug("{}: {}", cls.getName(), result.statusMessage());
        return result;
    }

    /** Equations of {@code fx} against {@code x + y + z + m}. */
    public BalanceCheckResult checkDaeBalance(Dae dae) {
        BalanceCheckResult result = BalanceCheckResult.of(countEquations(dae.getFx()), dae.unknownCount(),
                dae.getX().size(), dae.getP().size() + dae.getCp().size(), dae.getU().size());
        log.debug("{}: {}", dae.getName(), result.statusMessage());
        return result;
    }

    public int countEquations(List<Equation> equations) {
        int n = 0;
        for (Equation eq : equations)
            n += countEquation(eq);
        return n;
    }

    public int countEquation(Equation eq) {
        if (eq instanceof Equation.Simple || eq instanceof Equation.Connect)
            return 1;
        if (eq instanceof Equation.If i) {
            if (!i.elseEquations().isEmpty())
                return countEquations(i.elseEquations());
            return i.blocks().isEmpty() ? 0 : countEquations(i.blocks().get(0).equations());
        }
        if (eq instanceof Equation.For f) {
            int body = countEquations(f.equations());
            if (forCounting == ForCountingPolicy.BODY_ONCE)
                return body;
            try {
                long iterations = 1;
                for (Equation.ForIndex idx : f.indices()) {
                    long len = literalLength(idx.range());
                    if (len < 0)
                        return body;
                    iterations = Math.multiplyExact(iterations, len);
                }
                return Math.toIntExact(Math.multiplyExact(body, iterations));
            } catch (ArithmeticException e) {
                log.warn("for-equation count overflows int, counting body once: {}", e.getMessage());
                return body;
            }
        }
        // when and call equations are not continuous equations
        return 0;
    }

    /** Number of iterations of a literal range, or -1 when not statically known. */
    static long literalLength(Expression range) {
        if (range instanceof Expression.ArrayLiteral a)
            return a.elements().size();
        if (!(range instanceof Expression.Range r))
            return -1;
        Long start = intValue(r.start()), end = intValue(r.end());
        Long step = r.step() == null ? Long.valueOf(1) : intValue(r.step());
        if (start == null || end == null || step == null || step == 0)
            return -1;
        try {
            long len = Math.addExact(Math.subtractExact(end, start) / step, 1);
            return Math.max(len, 0);
        } catch (ArithmeticException e) {
            return -1;
        }
    }

    private static Long intValue(Expression e) {
        if (e instanceof Expression.Literal lit && lit.kind() == Expression.Literal.Kind.INTEGER) {
            try {
                return Long.parseLong(lit.text());
            } catch (NumberFormatException tooLarge) {
                return null;
            }
        }
        if (e instanceof Expression.Unary u && u.op() == UnaryOp.MINUS) {
            Long v = intValue(u.operand());
            return v == null || v == Long.MIN_VALUE ? null : -v;
        }
        return null;
    }
}
