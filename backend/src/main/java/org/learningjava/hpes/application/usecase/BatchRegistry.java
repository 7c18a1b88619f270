package org.learningjava.hpes.application.usecase;

import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.batch.BatchCancellation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Progress and cancellation tokens of repository batches, keyed by batch id.
 * Running batches are always kept; only the most recent finished ones are.
 */
@Component
public class BatchRegistry {

    public static final int DEFAULT_RETAINED = 100;

    public enum BatchState { RUNNING, DONE, TIMED_OUT, CANCELLED, FAILED }

    public record BatchStatus(
            String id,
            BatchState state,
            String message,
            int processed,
            int total
    ) {}

    private final Map<String, BatchStatus> batches = new ConcurrentHashMap<>();
    private final Map<String, BatchCancellation> tokens = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ArrayDeque<>();
    private final int retainFinished;

    public BatchRegistry() {
        this(DEFAULT_RETAINED);
    }

    public BatchRegistry(int retainFinished) {
        this.retainFinished = Math.max(retainFinished, 0);
    }

    @Autowired
    public BatchRegistry(ExtractionProperties props) {
        this(props.getBatch().getRetainFinished());
    }

    public String start(int total, BatchCancellation cancellation) {
        String id = UUID.randomUUID().toString();
        tokens.put(id, cancellation);
        batches.put(id, new BatchStatus(id, BatchState.RUNNING, "Started", 0, Math.max(total, 0)));
        return id;
    }

    public void update(String id, int processed, String message) {
        batches.computeIfPresent(id, (k, cur) -> new BatchStatus(id, BatchState.RUNNING,
                message != null ? message : cur.message(), processed, cur.total()));
    }

    public void done(String id, String message) {
        BatchStatus cur = batches.get(id);
        if (cur != null) {
            finish(id, BatchState.DONE, message != null ? message : "Done", cur.total());
        }
    }

    public void timedOut(String id, int processed) {
        finish(id, BatchState.TIMED_OUT, "Deadline reached", processed);
    }

    public void cancelled(String id, int processed) {
        finish(id, BatchState.CANCELLED, "Cancelled", processed);
    }

    public void fail(String id, String message) {
        BatchStatus cur = batches.get(id);
        if (cur != null) {
            finish(id, BatchState.FAILED, message != null ? message : "Failed", cur.processed());
        }
    }

    /** Requests cancellation of a running batch; false when the id is unknown or already finished. */
    public boolean cancel(String id) {
        BatchCancellation token = tokens.get(id);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public BatchStatus get(String id) {
        return batches.get(id);
    }

    public int size() {
        return batches.size();
    }

    private void finish(String id, BatchState state, String message, int processed) {
        BatchStatus updated = batches.computeIfPresent(id,
                (k, cur) -> new BatchStatus(id, state, message, processed, cur.total()));
        tokens.remove(id);
        if (updated == null) {
            return;
        }
        synchronized (finished) {
            finished.remove(id);
            finished.addLast(id);
            while (finished.size() > retainFinished) {
                batches.remove(finished.removeFirst());
            }
        }
    }
}
