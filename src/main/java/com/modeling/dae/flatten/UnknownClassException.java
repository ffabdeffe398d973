package com.modeling.dae.flatten;

import lombok.Getter;

/** A class name that the class table does not contain. */
@Getter
public class UnknownClassException extends FlattenException {
    private final String className;

    public UnknownClassException(String className) {
        this(className, "Class not found: " + className);
    }

    protected UnknownClassException(String className, String message) {
        super(message);
        this.className = className;
    }
}
