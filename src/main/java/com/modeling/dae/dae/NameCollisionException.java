package com.modeling.dae.dae;

import lombok.Getter;

/** Two distinct declarations would end up under the same flat name. */
@Getter
public class NameCollisionException extends AssemblyException {
    private final String flatName;
    private final String className;

    public NameCollisionException(String flatName, String className) {
        super("Flattened name " + flatName + " already declared in " + className);
        this.flatName = flatName;
        this.className = className;
    }
}
