package com.modeling.dae.io;

import com.modeling.dae.ModelCompilationException;

import lombok.Getter;

/** A class table document that cannot be read or decoded. */
@Getter
public class DefinitionException extends ModelCompilationException {
    /** Where the problem was found, e.g. {@code Ball.equations[2]}; may be empty. */
    private final String location;

    public DefinitionException(String location, String message) {
        super(location == null || location.isEmpty() ? message : location + ": " + message);
        this.location = location == null ? "" : location;
    }

    public DefinitionException(String location, String message, Throwable cause) {
        super(location == null || location.isEmpty() ? message : location + ": " + message, cause);
        this.location = location == null ? "" : location;
    }
}
