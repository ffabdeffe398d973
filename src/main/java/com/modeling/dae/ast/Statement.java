package com.modeling.dae.ast;

import java.util.List;

/** Algorithm section statement. */
public interface Statement {

    record Assignment(Expression.ComponentRef target, Expression value) implements Statement {
    }

    record ForStatement(List<Equation.ForIndex> indices, List<Statement> body) implements Statement {
        public ForStatement {
            indices = List.copyOf(indices);
            body = List.copyOf(body);
        }
    }

    record WhileStatement(Expression condition, List<Statement> body) implements Statement {
        public WhileStatement {
            body = List.copyOf(body);
        }
    }

    record CallStatement(String name, List<Expression> args) implements Statement {
        public CallStatement {
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    record Return() implements Statement {
    }

    record Break() implements Statement {
    }
}
