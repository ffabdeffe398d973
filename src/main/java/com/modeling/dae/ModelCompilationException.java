package com.modeling.dae;

/**
 * Base of every failure raised by the compilation pipeline.
 * Balance mismatches are not failures and never surface as this type.
 */
public class ModelCompilationException extends RuntimeException {
    public ModelCompilationException(String message) {
        super(message);
    }

    public ModelCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
