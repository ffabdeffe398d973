package com.modeling.dae.flatten;

import com.modeling.dae.ModelCompilationException;

/** Structural error found while resolving inheritance or instances. */
public class FlattenException extends ModelCompilationException {
    public FlattenException(String message) {
        super(message);
    }
}
