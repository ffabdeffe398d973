package com.modeling.dae.visitor;

import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.Statement;

/**
 * Read-only tree walk callbacks, driven by {@link TreeWalker}.
 * <p>
 * Every node gets {@code enter} before its children and {@code exit} after them.
 * Implementations override only what they need; visitors collect into their own
 * fields and never modify the tree (rewrites go through
 * {@link ExpressionTransformer}).
 */
public interface Visitor {
    default void enterClass(ClassDefinition node) {
    }

    default void exitClass(ClassDefinition node) {
    }

    default void enterComponent(Component node) {
    }

    default void exitComponent(Component node) {
    }

    default void enterEquation(Equation node) {
    }

    default void exitEquation(Equation node) {
    }

    default void enterStatement(Statement node) {
    }

    default void exitStatement(Statement node) {
    }

    default void enterExpression(Expression node) {
    }

    default void exitExpression(Expression node) {
    }

    /** Called between enter/exitExpression for reference nodes. */
    default void enterComponentRef(Expression.ComponentRef node) {
    }

    default void exitComponentRef(Expression.ComponentRef node) {
    }
}
