package com.modeling.dae.wiring;

import com.lmax.disruptor.EventHandler;
import com.modeling.dae.ModelCompiler;
import com.modeling.dae.ast.ClassDefinition;

import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * One of N consumers on the compile ring buffer. Every worker sees every
 * event and handles only the sequences with {@code sequence % N == ordinal},
 * so the batch is spread across workers without any coordination.
 */
final class CompileWorker implements EventHandler<CompileEvent> {
    private final int ordinal;
    private final int workerCount;
    private final ModelCompiler compiler;
    private final Map<String, ClassDefinition> classTable;
    private final WorkspaceResult[] results;
    private final CountDownLatch done;

    CompileWorker(int ordinal, int workerCount, ModelCompiler compiler, Map<String, ClassDefinition> classTable,
            WorkspaceResult[] results, CountDownLatch done) {
        this.ordinal = ordinal;
        this.workerCount = workerCount;
        this.compiler = compiler;
        this.classTable = classTable;
        this.results = results;
        this.done = done;
    }

    @Override
    public void onEvent(CompileEvent event, long sequence, boolean endOfBatch) {
        if (sequence % workerCount != ordinal)
            return;
        String className = event.getClassName();
        try {
            results[event.getSlot()] = WorkspaceResult.success(className, compiler.compile(classTable, className));
        } catch (Throwable t) {
            // any error is the result of this slot; the latch below must still count down
            results[event.getSlot()] = WorkspaceResult.failure(className, t);
        } finally {
            done.countDown();
        }
    }
}
