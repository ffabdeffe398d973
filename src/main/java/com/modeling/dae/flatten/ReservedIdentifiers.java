package com.modeling.dae.flatten;

import java.util.*;

/**
 * Names that resolve globally and are never prefixed with an instance scope.
 * Passed explicitly into the flattener so callers can supply their own builtins.
 */
public final class ReservedIdentifiers {
    public static final ReservedIdentifiers DEFAULT = of(
            "time", "der", "pre", "reinit", "edge", "change", "initial", "terminal", "noEvent",
            "sample", "assert", "sin", "cos", "tan", "asin", "acos", "atan", "atan2", "sinh",
            "cosh", "tanh", "exp", "log", "log10", "sqrt", "abs", "sign", "min", "max", "floor",
            "ceil", "mod", "rem", "integer", "smooth");

    private final Set<String> names;

    private ReservedIdentifiers(Set<String> names) {
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public static ReservedIdentifiers of(String... names) {
        return new ReservedIdentifiers(new LinkedHashSet<>(Arrays.asList(names)));
    }

    public static ReservedIdentifiers of(Collection<String> names) {
        return new ReservedIdentifiers(new LinkedHashSet<>(names));
    }

    /** Returns a copy extended with additional names. */
    public ReservedIdentifiers with(String... extra) {
        Set<String> s = new LinkedHashSet<>(names);
        s.addAll(Arrays.asList(extra));
        return new ReservedIdentifiers(s);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
