package com.modeling.dae.flatten;

import java.util.List;

import lombok.Getter;

/**
 * Inheritance or instantiation loops back on itself.
 * {@link #getCycle()} starts and ends with the same class name.
 */
@Getter
public class CyclicExtendsException extends FlattenException {
    private final List<String> cycle;
    private final boolean instanceCycle;

    public CyclicExtendsException(List<String> cycle, boolean instanceCycle) {
        super((instanceCycle ? "Cyclic instantiation: " : "Cyclic extends: ") + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
        this.instanceCycle = instanceCycle;
    }
}
