package org.learningjava.hpes.domain.model.batch;

/** Cancellation token shared between a batch and whoever may stop it. */
public final class BatchCancellation {

    private volatile boolean cancelled;

    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
