package org.learningjava.hpes.domain.model.parse;

import java.time.Duration;

/**
 * Cooperative time budget handed to a grammar adapter. Adapters that can interleave
 * checks call {@link #checkpoint()} at bounded intervals; the caller cancels the
 * budget once it stops waiting.
 */
public final class ParseBudget {

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private ParseBudget(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static ParseBudget of(Duration timeout) {
        return new ParseBudget(System.nanoTime() + timeout.toNanos());
    }

    public static ParseBudget unlimited() {
        return new ParseBudget(Long.MAX_VALUE);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isExhausted() {
        return cancelled
                || Thread.currentThread().isInterrupted()
                || (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos > 0);
    }

    public void checkpoint() {
        if (isExhausted()) {
            throw new ParseTimeoutException("parse budget exhausted");
        }
    }
}
