package com.modeling.dae.ast;

/** Direction of information flow at a model boundary. */
public enum Causality {
    NONE,
    INPUT,
    OUTPUT;

    public static Causality fromString(String s) {
        if (s == null || s.isBlank())
            return NONE;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown causality: " + s, e);
        }
    }
}
