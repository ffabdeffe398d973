package com.modeling.dae.dae;

import com.modeling.dae.ast.Expression;
import com.modeling.dae.visitor.Visitor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Collects every {@code v} that appears as the sole argument of {@code der(v)}. */
public final class StateFinder implements Visitor {
    private final Set<String> states = new LinkedHashSet<>();

    @Override
    public void exitExpression(Expression node) {
        if (node instanceof Expression.FunctionCall call && call.isNamed("der") && call.args().size() == 1
                && call.args().get(0) instanceof Expression.ComponentRef ref)
            states.add(ref.name());
    }

    /** States in order of first appearance. */
    public Set<String> states() {
        return Collections.unmodifiableSet(states);
    }
}
