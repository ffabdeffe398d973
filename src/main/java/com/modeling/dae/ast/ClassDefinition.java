package com.modeling.dae.ast;

import java.util.*;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named class: components in declaration order, extends clauses, equation and
 * algorithm sections.
 * <p>
 * Instances are immutable. The flattener never edits a definition taken from
 * the class table; it assembles a new one through {@link #toBuilder()} or
 * {@link #builder(String)}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ClassDefinition {
    private final String name;
    private final ClassType classType;
    private final boolean partial;
    private final boolean encapsulated;
    private final String description;
    private final Map<String, Component> components;
    private final List<Extend> extendsClauses;
    private final List<Equation> equations;
    private final List<Equation> initialEquations;
    private final List<List<Statement>> algorithms;
    private final List<List<Statement>> initialAlgorithms;

    private ClassDefinition(Builder b) {
        this.name = b.name;
        this.classType = b.classType;
        this.partial = b.partial;
        this.encapsulated = b.encapsulated;
        this.description = b.description;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(b.components));
        this.extendsClauses = List.copyOf(b.extendsClauses);
        this.equations = List.copyOf(b.equations);
        this.initialEquations = List.copyOf(b.initialEquations);
        this.algorithms = b.algorithms.stream().map(List::copyOf).toList();
        this.initialAlgorithms = b.initialAlgorithms.stream().map(List::copyOf).toList();
    }

    public Component component(String componentName) {
        return components.get(componentName);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name)
                .classType(classType)
                .partial(partial)
                .encapsulated(encapsulated)
                .description(description);
        b.components.putAll(components);
        b.extendsClauses.addAll(extendsClauses);
        b.equations.addAll(equations);
        b.initialEquations.addAll(initialEquations);
        b.algorithms.addAll(algorithms);
        b.initialAlgorithms.addAll(initialAlgorithms);
        return b;
    }

    public static final class Builder {
        private String name;
        private ClassType classType = ClassType.MODEL;
        private boolean partial;
        private boolean encapsulated;
        private String description = "";
        private final LinkedHashMap<String, Component> components = new LinkedHashMap<>();
        private final List<Extend> extendsClauses = new ArrayList<>();
        private final List<Equation> equations = new ArrayList<>();
        private final List<Equation> initialEquations = new ArrayList<>();
        private final List<List<Statement>> algorithms = new ArrayList<>();
        private final List<List<Statement>> initialAlgorithms = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank())
                throw new IllegalArgumentException("Class requires a name");
            this.name = name;
        }

        public Builder name(String n) {
            this.name = n;
            return this;
        }

        public Builder classType(ClassType t) {
            this.classType = t == null ? ClassType.MODEL : t;
            return this;
        }

        public Builder partial(boolean p) {
            this.partial = p;
            return this;
        }

        public Builder encapsulated(boolean e) {
            this.encapsulated = e;
            return this;
        }

        public Builder description(String d) {
            this.description = d == null ? "" : d;
            return this;
        }

        /** Adds a component; names must be unique within the class. */
        public Builder addComponent(Component c) {
            if (components.containsKey(c.name()))
                throw new IllegalArgumentException("Duplicate component " + c.name() + " in class " + name);
            components.put(c.name(), c);
            return this;
        }

        /** Inserts or replaces in place, keeping the original declaration position. */
        public Builder putComponent(Component c) {
            components.put(c.name(), c);
            return this;
        }

        public Builder removeComponent(String componentName) {
            components.remove(componentName);
            return this;
        }

        public boolean hasComponent(String componentName) {
            return components.containsKey(componentName);
        }

        public Builder clearComponents() {
            components.clear();
            return this;
        }

        public Builder addExtends(String baseName) {
            extendsClauses.add(new Extend(baseName));
            return this;
        }

        public Builder clearExtends() {
            extendsClauses.clear();
            return this;
        }

        public Builder addEquation(Equation eq) {
            equations.add(eq);
            return this;
        }

        public Builder equations(List<Equation> eqs) {
            equations.clear();
            equations.addAll(eqs);
            return this;
        }

        public Builder addInitialEquation(Equation eq) {
            initialEquations.add(eq);
            return this;
        }

        public Builder initialEquations(List<Equation> eqs) {
            initialEquations.clear();
            initialEquations.addAll(eqs);
            return this;
        }

        public Builder addAlgorithm(List<Statement> block) {
            algorithms.add(block);
            return this;
        }

        public Builder algorithms(List<List<Statement>> blocks) {
            algorithms.clear();
            algorithms.addAll(blocks);
            return this;
        }

        public Builder addInitialAlgorithm(List<Statement> block) {
            initialAlgorithms.add(block);
            return this;
        }

        public Builder initialAlgorithms(List<List<Statement>> blocks) {
            initialAlgorithms.clear();
            initialAlgorithms.addAll(blocks);
            return this;
        }

        public ClassDefinition build() {
            return new ClassDefinition(this);
        }
    }
}
