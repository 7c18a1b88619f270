package org.learningjava.hpes.domain.model.batch;

import org.learningjava.hpes.domain.model.ExtractionResult;

/**
 * Per-file slot of a batch. Only {@link FileStatus#COMPLETED} outcomes carry a result.
 */
public record FileOutcome(String path, FileStatus status, ExtractionResult result, String message) {

    public static FileOutcome completed(String path, ExtractionResult result) {
        return new FileOutcome(path, FileStatus.COMPLETED, result, null);
    }

    public static FileOutcome unfinished(String path, FileStatus status) {
        return new FileOutcome(path, status, null, status == FileStatus.TIMED_OUT
                ? "batch deadline reached" : "batch cancelled");
    }

    public static FileOutcome failed(String path, String message) {
        return new FileOutcome(path, FileStatus.FAILED, null, message);
    }

    public boolean isCompleted() {
        return status == FileStatus.COMPLETED;
    }
}
