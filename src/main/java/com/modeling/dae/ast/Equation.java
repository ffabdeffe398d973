package com.modeling.dae.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Equation section entry. The variants are the records nested here.
 */
public interface Equation {

    /** {@code lhs = rhs}. */
    record Simple(Expression lhs, Expression rhs) implements Equation {
        public Simple {
            if (lhs == null || rhs == null)
                throw new IllegalArgumentException("Simple equation requires both sides");
        }

        public Simple swapped() {
            return new Simple(rhs, lhs);
        }
    }

    /** {@code connect(lhs, rhs)}; kept structural, never expanded by the core. */
    record Connect(Expression.ComponentRef lhs, Expression.ComponentRef rhs) implements Equation {
    }

    record ForIndex(String name, Expression range) {
    }

    record For(List<ForIndex> indices, List<Equation> equations) implements Equation {
        public For {
            indices = List.copyOf(indices);
            equations = List.copyOf(equations);
        }
    }

    /** A guarded group of equations: one branch of an if- or when-equation. */
    record EquationBlock(Expression condition, List<Equation> equations) {
        public EquationBlock {
            equations = List.copyOf(equations);
        }
    }

    record When(List<EquationBlock> blocks) implements Equation {
        public When {
            blocks = List.copyOf(blocks);
        }
    }

    record If(List<EquationBlock> blocks, List<Equation> elseEquations) implements Equation {
        public If {
            blocks = List.copyOf(blocks);
            elseEquations = elseEquations == null ? List.of() : List.copyOf(elseEquations);
        }
    }

    /** Bare call in equation position, e.g. {@code assert(...)} or {@code reinit(v, e)}. */
    record FunctionCallEquation(String name, List<Expression> args) implements Equation {
        public FunctionCallEquation {
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    static Simple simple(Expression lhs, Expression rhs) {
        return new Simple(lhs, rhs);
    }

    static FunctionCallEquation call(String name, Expression... args) {
        return new FunctionCallEquation(name, Arrays.asList(args));
    }
}
