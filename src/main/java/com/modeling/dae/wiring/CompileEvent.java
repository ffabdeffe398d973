package com.modeling.dae.wiring;

/**
 * Mutable ring buffer slot naming one root class to compile.
 *
 * <p>
 * Instances are pre-allocated by the ring buffer and reused for every batch;
 * {@code slot} is the position of the request in the caller's list, which is
 * where the worker stores its result.
 */
public final class CompileEvent {
    private int slot = -1;
    private String className;

    public void set(int slot, String className) {
        this.slot = slot;
        this.className = className;
    }

    public void clear() {
        this.slot = -1;
        this.className = null;
    }

    public int getSlot() {
        return slot;
    }

    public String getClassName() {
        return className;
    }
}
