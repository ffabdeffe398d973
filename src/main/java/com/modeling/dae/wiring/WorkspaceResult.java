package com.modeling.dae.wiring;

import com.modeling.dae.CompilationResult;

/**
 * Outcome for one root class: exactly one of {@code result} and {@code error}
 * is set.
 */
public record WorkspaceResult(String className, CompilationResult result, Throwable error) {

    public static WorkspaceResult success(String className, CompilationResult result) {
        return new WorkspaceResult(className, result, null);
    }

    public static WorkspaceResult failure(String className, Throwable error) {
        return new WorkspaceResult(className, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
