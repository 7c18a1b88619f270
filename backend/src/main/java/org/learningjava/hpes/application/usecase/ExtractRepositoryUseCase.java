package org.learningjava.hpes.application.usecase;

import org.learningjava.hpes.application.port.SourceTreeReaderPort;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.ExtractionRequest;
import org.learningjava.hpes.domain.model.InputDecodeException;
import org.learningjava.hpes.domain.model.batch.BatchCancellation;
import org.learningjava.hpes.domain.model.batch.BatchRequest;
import org.learningjava.hpes.domain.model.batch.BatchResult;
import org.learningjava.hpes.domain.model.batch.FileOutcome;
import org.learningjava.hpes.domain.model.batch.FileStatus;
import org.learningjava.hpes.domain.model.batch.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Extracts many files under one deadline. Files run on a fixed pool sized by the
 * request; when the deadline passes or the batch is cancelled the pool is
 * interrupted, finished files keep their results and the rest are reported as
 * unfinished. Submitted batches run in the background and can be cancelled by id.
 */
@Service
public class ExtractRepositoryUseCase {

    private static final Logger log = LoggerFactory.getLogger(ExtractRepositoryUseCase.class);

    private static final long SLICE_MILLIS = 50;

    private final ExtractBlocksUseCase extractor;
    private final SourceTreeReaderPort treeReader;
    private final BatchRegistry batches;
    private final ExtractionProperties.Batch defaults;
    private final AsyncTaskExecutor launcher;

    /** A batch running in the background. */
    public record BatchHandle(String batchId, CompletableFuture<BatchResult> result) {}

    public ExtractRepositoryUseCase(ExtractBlocksUseCase extractor,
                                    SourceTreeReaderPort treeReader,
                                    BatchRegistry batches,
                                    ExtractionProperties props,
                                    @Qualifier("batchLauncher") AsyncTaskExecutor launcher) {
        this.extractor = extractor;
        this.treeReader = treeReader;
        this.batches = batches;
        this.defaults = props.getBatch();
        this.launcher = launcher;
    }

    public BatchResult extractDirectory(Path root, BatchCancellation cancellation) {
        return extractAll(directoryRequest(root), cancellation);
    }

    public BatchHandle submitDirectory(Path root) {
        return submit(directoryRequest(root));
    }

    /** Registers the batch and runs it on the launcher pool; cancel it with {@link #cancel(String)}. */
    public BatchHandle submit(BatchRequest request) {
        BatchCancellation cancellation = new BatchCancellation();
        String batchId = batches.start(request.files().size(), cancellation);
        CompletableFuture<BatchResult> result = CompletableFuture.supplyAsync(
                () -> run(batchId, request, cancellation), launcher);
        return new BatchHandle(batchId, result);
    }

    public boolean cancel(String batchId) {
        boolean found = batches.cancel(batchId);
        if (found) {
            log.info("Batch {} cancellation requested", batchId);
        }
        return found;
    }

    public BatchRegistry.BatchStatus status(String batchId) {
        return batches.get(batchId);
    }

    public BatchResult extractAll(BatchRequest request, BatchCancellation cancellation) {
        String batchId = batches.start(request.files().size(), cancellation);
        return run(batchId, request, cancellation);
    }

    private BatchRequest directoryRequest(Path root) {
        List<SourceFile> files = treeReader.read(root);
        return new BatchRequest(files, defaults.getConcurrency(), defaults.getTimeout());
    }

    private BatchResult run(String batchId, BatchRequest request, BatchCancellation cancellation) {
        try {
            return runFiles(batchId, request, cancellation);
        } catch (RuntimeException e) {
            log.error("Batch {} failed", batchId, e);
            batches.fail(batchId, e.toString());
            throw e;
        }
    }

    private BatchResult runFiles(String batchId, BatchRequest request, BatchCancellation cancellation) {
        List<SourceFile> files = request.files();
        log.info("Batch {} started: {} files, concurrency {}, timeout {}",
                batchId, files.size(), request.concurrency(), request.timeout());

        if (cancellation.isCancelled()) {
            batches.cancelled(batchId, 0);
            return BatchResult.of(batchId, unfinished(files, FileStatus.CANCELLED), false, true);
        }

        ExecutorService pool = Executors.newFixedThreadPool(request.concurrency(),
                new CustomizableThreadFactory("hpes-batch-"));
        List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            futures.add(pool.submit(() -> extractOne(file)));
        }
        pool.shutdown();

        long deadline = System.nanoTime() + request.timeout().toNanos();
        boolean timedOut = false;
        boolean cancelled = false;
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                long slice = Math.min(TimeUnit.MILLISECONDS.toNanos(SLICE_MILLIS), Math.max(remaining, 0));
                if (pool.awaitTermination(slice, TimeUnit.NANOSECONDS)) {
                    break;
                }
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    break;
                }
                if (deadline - System.nanoTime() <= 0) {
                    timedOut = true;
                    break;
                }
                batches.update(batchId, countDone(futures), null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
        }

        boolean[] finished = new boolean[futures.size()];
        for (int i = 0; i < futures.size(); i++) {
            finished[i] = futures.get(i).isDone();
        }
        if (timedOut || cancelled) {
            pool.shutdownNow();
        }

        FileStatus unfinishedStatus = cancelled ? FileStatus.CANCELLED : FileStatus.TIMED_OUT;
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        int processed = 0;
        for (int i = 0; i < files.size(); i++) {
            String path = files.get(i).path();
            if (finished[i]) {
                outcomes.add(collect(path, futures.get(i)));
                processed++;
            } else {
                outcomes.add(FileOutcome.unfinished(path, unfinishedStatus));
            }
        }

        BatchResult result = BatchResult.of(batchId, outcomes, timedOut, cancelled);
        if (cancelled) {
            batches.cancelled(batchId, processed);
        } else if (timedOut) {
            batches.timedOut(batchId, processed);
        } else {
            batches.done(batchId, null);
        }
        log.info("Batch {} finished: {} (timedOut={}, cancelled={}), {} blocks",
                batchId, result.countsByStatus(), timedOut, cancelled, result.stats().totalExtracted());
        return result;
    }

    private FileOutcome extractOne(SourceFile file) {
        try {
            return FileOutcome.completed(file.path(), extractor.extract(ExtractionRequest.of(file.path(), file.content())));
        } catch (InputDecodeException e) {
            log.warn("Cannot decode {}: {}", file.path(), e.getMessage());
            return FileOutcome.failed(file.path(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Extraction failed for {}", file.path(), e);
            return FileOutcome.failed(file.path(), e.toString());
        }
    }

    private static FileOutcome collect(String path, Future<FileOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileOutcome.unfinished(path, FileStatus.CANCELLED);
        } catch (ExecutionException e) {
            log.error("Extraction crashed for {}", path, e.getCause());
            return FileOutcome.failed(path, String.valueOf(e.getCause()));
        }
    }

    private static List<FileOutcome> unfinished(List<SourceFile> files, FileStatus status) {
        return files.stream().map(f -> FileOutcome.unfinished(f.path(), status)).toList();
    }

    private static int countDone(List<Future<FileOutcome>> futures) {
        return (int) futures.stream().filter(Future::isDone).count();
    }
}
