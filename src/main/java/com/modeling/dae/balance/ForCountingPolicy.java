package com.modeling.dae.balance;

/** How a for-equation contributes to the equation count. */
public enum ForCountingPolicy {
    /** The body is counted once, whatever the range. */
    BODY_ONCE,
    /**
     * The body is multiplied by the range length when the range is an integer
     * literal range such as {@code 1:5} or {@code 1:2:9}, or an array literal;
     * any other range counts once.
     */
    EXPAND_LITERAL_RANGES
}
