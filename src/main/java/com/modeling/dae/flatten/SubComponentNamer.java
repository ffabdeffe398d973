package com.modeling.dae.flatten;

import com.modeling.dae.ast.Expression;
import com.modeling.dae.visitor.ExpressionTransformer;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collapses dotted references into expanded instances, {@code inst.sub.x}
 * becoming {@code inst_sub_x}. Subscripts of the last segment are kept.
 */
final class SubComponentNamer extends ExpressionTransformer {
    private final Set<String> instances;

    SubComponentNamer(Set<String> instances) {
        this.instances = instances;
    }

    @Override
    protected Expression.ComponentRef transformRef(Expression.ComponentRef ref) {
        if (!ref.isDotted() || !instances.contains(ref.head()))
            return ref;
        List<Expression.RefPart> parts = ref.parts();
        String flat = parts.stream().map(Expression.RefPart::name).collect(Collectors.joining("_"));
        Expression.RefPart last = parts.get(parts.size() - 1);
        return new Expression.ComponentRef(List.of(new Expression.RefPart(flat, last.subscripts())));
    }
}
