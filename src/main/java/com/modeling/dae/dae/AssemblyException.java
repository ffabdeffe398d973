package com.modeling.dae.dae;

import com.modeling.dae.ModelCompilationException;

/** The flat class cannot be turned into a DAE. */
public class AssemblyException extends ModelCompilationException {
    public AssemblyException(String message) {
        super(message);
    }
}
