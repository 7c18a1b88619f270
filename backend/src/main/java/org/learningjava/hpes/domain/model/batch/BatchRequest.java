package org.learningjava.hpes.domain.model.batch;

import java.time.Duration;
import java.util.List;

/**
 * @param concurrency ceiling on files extracted at the same time
 * @param timeout     pool-wide deadline for the whole batch
 */
public record BatchRequest(List<SourceFile> files, int concurrency, Duration timeout) {

    public BatchRequest {
        files = List.copyOf(files);
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, was " + concurrency);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
