package com.modeling.dae.ast;

/** Restricted class kind. */
public enum ClassType {
    MODEL,
    BLOCK,
    RECORD,
    CONNECTOR,
    FUNCTION,
    PACKAGE,
    TYPE,
    OPERATOR,
    CLASS;

    public static ClassType fromString(String s) {
        if (s == null || s.isBlank())
            return MODEL;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown class type: " + s, e);
        }
    }
}
