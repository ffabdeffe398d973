package com.modeling.dae.api;

/** Pipeline stages in execution order. */
public enum Stage {
    FLATTEN,
    ASSEMBLE,
    ORDER,
    BALANCE
}
