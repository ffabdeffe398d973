package com.modeling.dae.flatten;

import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.Statement;
import com.modeling.dae.visitor.ExpressionTransformer;

import java.util.*;

/**
 * Prefixes every component reference with an instance name, turning {@code x}
 * inside the instance's class into {@code inst.x}.
 * <p>
 * Reserved identifiers and for-loop indices bound inside the rewritten
 * equations stay untouched.
 */
final class ScopePusher extends ExpressionTransformer {
    private final String scope;
    private final ReservedIdentifiers reserved;
    private final Deque<Set<String>> loopIndices = new ArrayDeque<>();

    ScopePusher(String scope, ReservedIdentifiers reserved) {
        this.scope = scope;
        this.reserved = reserved;
    }

    @Override
    public Equation apply(Equation eq) {
        if (eq instanceof Equation.For f) {
            loopIndices.push(indexNames(f.indices()));
            try {
                return super.apply(eq);
            } finally {
                loopIndices.pop();
            }
        }
        return super.apply(eq);
    }

    @Override
    public Statement apply(Statement st) {
        if (st instanceof Statement.ForStatement f) {
            loopIndices.push(indexNames(f.indices()));
            try {
                return super.apply(st);
            } finally {
                loopIndices.pop();
            }
        }
        return super.apply(st);
    }

    @Override
    protected Expression.ComponentRef transformRef(Expression.ComponentRef ref) {
        String head = ref.head();
        if (reserved.contains(head) || isLoopIndex(head))
            return ref;
        List<Expression.RefPart> parts = new ArrayList<>(ref.parts().size() + 1);
        parts.add(Expression.RefPart.of(scope));
        parts.addAll(ref.parts());
        return new Expression.ComponentRef(parts);
    }

    private boolean isLoopIndex(String name) {
        for (Set<String> s : loopIndices)
            if (s.contains(name))
                return true;
        return false;
    }

    private static Set<String> indexNames(List<Equation.ForIndex> indices) {
        Set<String> s = new HashSet<>();
        for (Equation.ForIndex idx : indices)
            s.add(idx.name());
        return s;
    }
}
