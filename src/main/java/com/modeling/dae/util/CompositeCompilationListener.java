package com.modeling.dae.util;

import com.modeling.dae.CompilationResult;
import com.modeling.dae.api.CompilationListener;
import com.modeling.dae.api.Stage;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link CompilationListener}s. The listener
 * array is replaced on every add, so iteration never sees a partial update.
 */
public class CompositeCompilationListener implements CompilationListener {
    private volatile CompilationListener[] listeners = new CompilationListener[0];

    public synchronized void addForComposite(CompilationListener listener) {
        CompilationListener[] old = listeners;
        CompilationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStageComplete(String model, Stage stage, long durationNanos) {
        for (CompilationListener l : listeners)
            l.onStageComplete(model, stage, durationNanos);
    }

    @Override
    public void onCompiled(String model, CompilationResult result) {
        for (CompilationListener l : listeners)
            l.onCompiled(model, result);
    }

    @Override
    public void onFailed(String model, Stage stage, Throwable error) {
        for (CompilationListener l : listeners)
            l.onFailed(model, stage, error);
    }
}
