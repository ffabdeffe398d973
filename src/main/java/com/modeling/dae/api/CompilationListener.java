package com.modeling.dae.api;

import com.modeling.dae.CompilationResult;

/**
 * Observability hook for the compilation pipeline.
 *
 * <p>
 * Callbacks run on the compiling thread. When models are compiled by the
 * workspace compiler that means several worker threads at once, so
 * implementations must be thread-safe and cheap.
 */
public interface CompilationListener {

    /**
     * Called after a stage finished successfully.
     *
     * @param model         root class being compiled
     * @param stage         the stage that ran
     * @param durationNanos wall time of the stage
     */
    void onStageComplete(String model, Stage stage, long durationNanos);

    /** Called once the whole pipeline succeeded. */
    void onCompiled(String model, CompilationResult result);

    /**
     * Called when a stage failed; the error is rethrown to the caller
     * afterwards.
     */
    void onFailed(String model, Stage stage, Throwable error);
}
