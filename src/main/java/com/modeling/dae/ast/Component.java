package com.modeling.dae.ast;

import java.util.List;
import java.util.Set;

/**
 * Declared variable or sub-model instance.
 * <p>
 * Whether a component is an instance depends on the class table it is resolved
 * against, so that decision lives in the flattener, not here.
 */
public record Component(String name, String typeName, Variability variability, Causality causality,
        Connection connection, List<Expression> shape, Expression start, String description) {

    /** Built-in scalar type names; never looked up in the class table. */
    public static final Set<String> PRIMITIVE_TYPES = Set.of("Real", "Integer", "Boolean", "String");

    public Component {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Component requires a name");
        if (typeName == null || typeName.isEmpty())
            throw new IllegalArgumentException("Component " + name + " requires a type name");
        variability = variability == null ? Variability.CONTINUOUS : variability;
        causality = causality == null ? Causality.NONE : causality;
        connection = connection == null ? Connection.NONE : connection;
        shape = shape == null ? List.of() : List.copyOf(shape);
        description = description == null ? "" : description;
    }

    public static Component real(String name) {
        return builder(name, "Real").build();
    }

    public boolean isPrimitive() {
        return PRIMITIVE_TYPES.contains(typeName);
    }

    public Component withName(String newName) {
        return new Component(newName, typeName, variability, causality, connection, shape, start, description);
    }

    public Component withStart(Expression newStart) {
        return new Component(name, typeName, variability, causality, connection, shape, newStart, description);
    }

    public Component withShape(List<Expression> newShape) {
        return new Component(name, typeName, variability, causality, connection, newShape, start, description);
    }

    public static Builder builder(String name, String typeName) {
        return new Builder(name, typeName);
    }

    public static final class Builder {
        private final String name;
        private final String typeName;
        private Variability variability = Variability.CONTINUOUS;
        private Causality causality = Causality.NONE;
        private Connection connection = Connection.NONE;
        private List<Expression> shape = List.of();
        private Expression start;
        private String description = "";

        private Builder(String name, String typeName) {
            this.name = name;
            this.typeName = typeName;
        }

        public Builder variability(Variability v) {
            this.variability = v;
            return this;
        }

        public Builder causality(Causality c) {
            this.causality = c;
            return this;
        }

        public Builder connection(Connection c) {
            this.connection = c;
            return this;
        }

        public Builder shape(List<Expression> s) {
            this.shape = s;
            return this;
        }

        public Builder start(Expression s) {
            this.start = s;
            return this;
        }

        public Builder description(String d) {
            this.description = d;
            return this;
        }

        public Component build() {
            return new Component(name, typeName, variability, causality, connection, shape, start, description);
        }
    }
}
