package dev.tributary.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch-level cancellation signal. Once cancelled, the orchestrator dispatches no new records;
 * records already running finish or hit the run deadline.
 */
public final class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
