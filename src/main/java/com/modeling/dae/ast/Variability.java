package com.modeling.dae.ast;

/** Whether a variable may change over time. */
public enum Variability {
    CONTINUOUS,
    DISCRETE,
    PARAMETER,
    CONSTANT;

    /** True for values fixed for the whole simulation run. */
    public boolean isFixed() {
        return this == PARAMETER || this == CONSTANT;
    }

    public static Variability fromString(String s) {
        if (s == null || s.isBlank())
            return CONTINUOUS;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown variability: " + s, e);
        }
    }
}
