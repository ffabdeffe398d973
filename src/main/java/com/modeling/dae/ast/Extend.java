package com.modeling.dae.ast;

/** {@code extends Base;} clause. */
public record Extend(String baseName) {
    public Extend {
        if (baseName == null || baseName.isBlank())
            throw new IllegalArgumentException("extends clause requires a base class name");
    }
}
