package com.modeling.dae.flatten;

import lombok.Getter;

/** The target of an {@code extends} clause is missing. */
@Getter
public class BaseClassNotFoundException extends UnknownClassException {
    private final String extendingClass;

    public BaseClassNotFoundException(String baseName, String extendingClass) {
        super(baseName, "Base class " + baseName + " extended by " + extendingClass + " not found");
        this.extendingClass = extendingClass;
    }

    public String getBaseName() {
        return getClassName();
    }
}
