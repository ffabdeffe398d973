package com.modeling.dae.dae;

import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.visitor.Visitor;

import java.util.*;

/**
 * Names every when-branch condition {@code __c0, __c1, ...} in traversal
 * order.
 */
public final class ConditionFinder implements Visitor {
    public static final String PREFIX = "__c";

    private final Map<String, Expression> conditions = new LinkedHashMap<>();
    // blocks are value records; identical branches in two whens still get two names
    private final Map<Equation.EquationBlock, String> names = new IdentityHashMap<>();

    @Override
    public void enterEquation(Equation node) {
        if (node instanceof Equation.When when) {
            for (Equation.EquationBlock block : when.blocks()) {
                String name = PREFIX + conditions.size();
                conditions.put(name, block.condition());
                names.put(block, name);
            }
        }
    }

    public Map<String, Expression> conditions() {
        return Collections.unmodifiableMap(conditions);
    }

    /** Generated name of a branch seen by this finder, or null. */
    public String nameOf(Equation.EquationBlock block) {
        return names.get(block);
    }
}
