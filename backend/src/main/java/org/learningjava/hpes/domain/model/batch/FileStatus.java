package org.learningjava.hpes.domain.model.batch;

public enum FileStatus {
    COMPLETED,
    TIMED_OUT,
    CANCELLED,
    FAILED
}
