package com.modeling.dae.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression tree node.
 * <p>
 * The variants are the records nested in this interface; every consumer
 * dispatches over exactly this set. Nodes are immutable values: two expressions
 * are equal when their content is equal, which is what the orderer and the tests
 * rely on.
 */
public interface Expression {

    /** Terminal constant. {@code text} is kept verbatim as written in the source. */
    record Literal(Kind kind, String text) implements Expression {
        public enum Kind {
            INTEGER, REAL, BOOLEAN, STRING
        }

        public Literal {
            if (kind == null || text == null)
                throw new IllegalArgumentException("Literal requires kind and text");
        }

        public static Literal ofInt(long v) {
            return new Literal(Kind.INTEGER, Long.toString(v));
        }

        public static Literal ofReal(double v) {
            return new Literal(Kind.REAL, Double.toString(v));
        }

        public static Literal ofBool(boolean v) {
            return new Literal(Kind.BOOLEAN, Boolean.toString(v));
        }

        public static Literal ofString(String v) {
            return new Literal(Kind.STRING, v);
        }

        @Override
        public String toString() {
            return kind == Kind.STRING ? '"' + text + '"' : text;
        }
    }

    /** One segment of a dotted reference, with optional subscripts. */
    record RefPart(String name, List<Expression> subscripts) {
        public RefPart {
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("Reference part requires a name");
            subscripts = subscripts == null ? List.of() : List.copyOf(subscripts);
        }

        public static RefPart of(String name) {
            return new RefPart(name, List.of());
        }

        @Override
        public String toString() {
            if (subscripts.isEmpty())
                return name;
            return name + subscripts.stream().map(Object::toString).collect(Collectors.joining(",", "[", "]"));
        }
    }

    /** Possibly dotted, possibly subscripted variable reference such as {@code a.b[1]}. */
    record ComponentRef(List<RefPart> parts) implements Expression {
        public ComponentRef {
            if (parts == null || parts.isEmpty())
                throw new IllegalArgumentException("Component reference requires at least one part");
            parts = List.copyOf(parts);
        }

        /** Parses a plain dotted name; subscripts are not recognized here. */
        public static ComponentRef of(String dotted) {
            List<RefPart> ps = new ArrayList<>();
            for (String p : dotted.split("\\."))
                ps.add(RefPart.of(p));
            return new ComponentRef(ps);
        }

        /** Dotted name without subscripts. */
        public String name() {
            return parts.stream().map(RefPart::name).collect(Collectors.joining("."));
        }

        public String head() {
            return parts.get(0).name();
        }

        public boolean isDotted() {
            return parts.size() > 1;
        }

        @Override
        public String toString() {
            return parts.stream().map(RefPart::toString).collect(Collectors.joining("."));
        }
    }

    record Unary(UnaryOp op, Expression operand) implements Expression {
    }

    record Binary(BinaryOp op, Expression lhs, Expression rhs) implements Expression {
    }

    /** Call of a named function. {@code der(x)} is a call named {@code der}. */
    record FunctionCall(String name, List<Expression> args) implements Expression {
        public FunctionCall {
            args = args == null ? List.of() : List.copyOf(args);
        }

        public boolean isNamed(String n) {
            return name.equals(n);
        }
    }

    record ArrayLiteral(List<Expression> elements) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    record Tuple(List<Expression> elements) implements Expression {
        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    /** {@code start:end} or {@code start:step:end}; {@code step} may be null. */
    record Range(Expression start, Expression step, Expression end) implements Expression {
    }

    record Branch(Expression condition, Expression value) {
    }

    /** {@code if c1 then v1 elseif c2 then v2 else e}. */
    record Conditional(List<Branch> branches, Expression elseValue) implements Expression {
        public Conditional {
            branches = List.copyOf(branches);
        }
    }

    // Shorthand constructors, mostly for hand-built trees.

    static ComponentRef ref(String dotted) {
        return ComponentRef.of(dotted);
    }

    static FunctionCall call(String name, Expression... args) {
        return new FunctionCall(name, Arrays.asList(args));
    }

    static FunctionCall der(String variable) {
        return call("der", ref(variable));
    }

    static Binary binary(BinaryOp op, Expression lhs, Expression rhs) {
        return new Binary(op, lhs, rhs);
    }

    static Literal num(long v) {
        return Literal.ofInt(v);
    }

    static Literal num(double v) {
        return Literal.ofReal(v);
    }
}
