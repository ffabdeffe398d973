package com.modeling.dae.ast;

/** Connector prefix of a component: plain potential, flow or stream. */
public enum Connection {
    NONE,
    FLOW,
    STREAM;

    public static Connection fromString(String s) {
        if (s == null || s.isBlank())
            return NONE;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown connection prefix: " + s, e);
        }
    }
}
