package com.modeling.dae.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.modeling.dae.ModelCompilationException;
import com.modeling.dae.ModelCompiler;
import com.modeling.dae.ast.ClassDefinition;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.CountDownLatch;

/**
 * Compiles many root classes of one class table in parallel.
 *
 * <p>
 * Requests are published to an LMAX Disruptor ring buffer by the calling
 * thread and consumed by {@code workers} sharded {@link CompileWorker}s. The
 * class table is only read, so all workers share it. Each call builds and
 * shuts down its own disruptor; failures are kept per class and never abort
 * the batch.
 */
public final class WorkspaceCompiler {
    private static final Logger log = LogManager.getLogger(WorkspaceCompiler.class);

    private final ModelCompiler compiler;
    private final int workers;
    private final int ringBufferSize;

    public WorkspaceCompiler(ModelCompiler compiler) {
        this(compiler, compiler.options().getWorkers(), compiler.options().getRingBufferSize());
    }

    public WorkspaceCompiler(ModelCompiler compiler, int workers, int ringBufferSize) {
        if (workers < 1)
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2: " + ringBufferSize);
        this.compiler = compiler;
        this.workers = workers;
        this.ringBufferSize = ringBufferSize;
    }

    /** Compiles every class of the table as a root. */
    public Map<String, WorkspaceResult> compileAll(Map<String, ClassDefinition> classTable) {
        return compileAll(classTable, new ArrayList<>(classTable.keySet()));
    }

    /**
     * Compiles each named root. Duplicate names are compiled once.
     *
     * @return results keyed by class name, in request order
     */
    public Map<String, WorkspaceResult> compileAll(Map<String, ClassDefinition> classTable, List<String> roots) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(roots));
        Map<String, WorkspaceResult> out = new LinkedHashMap<>();
        if (unique.isEmpty())
            return out;

        int n = Math.min(workers, unique.size());
        WorkspaceResult[] results = new WorkspaceResult[unique.size()];
        CountDownLatch done = new CountDownLatch(unique.size());

        Disruptor<CompileEvent> disruptor = new Disruptor<>(
                CompileEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        CompileWorker[] handlers = new CompileWorker[n];
        for (int i = 0; i < n; i++)
            handlers[i] = new CompileWorker(i, n, compiler, classTable, results, done);
        disruptor.handleEventsWith(handlers);
        RingBuffer<CompileEvent> ringBuffer = disruptor.start();

        long start = System.nanoTime();
        try {
            for (int slot = 0; slot < unique.size(); slot++) {
                long sequence = ringBuffer.next();
                try {
                    ringBuffer.get(sequence).set(slot, unique.get(slot));
                } finally {
                    ringBuffer.publish(sequence);
                }
            }
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelCompilationException("Interrupted while compiling workspace", e);
        } finally {
            disruptor.shutdown();
        }

        int failed = 0;
        for (int slot = 0; slot < unique.size(); slot++) {
            WorkspaceResult r = results[slot];
            if (r == null)
                r = WorkspaceResult.failure(unique.get(slot), new IllegalStateException("No result recorded"));
            out.put(unique.get(slot), r);
            if (!r.succeeded())
                failed++;
        }
        log.info("Compiled {} models on {} workers in {} ms, {} failed", unique.size(), n,
                (System.nanoTime() - start) / 1_000_000, failed);
        return out;
    }
}
