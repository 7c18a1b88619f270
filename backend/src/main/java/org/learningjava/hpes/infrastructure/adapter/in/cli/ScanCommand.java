package org.learningjava.hpes.infrastructure.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.learningjava.hpes.application.usecase.ExtractBlocksUseCase;
import org.learningjava.hpes.application.usecase.ExtractRepositoryUseCase;
import org.learningjava.hpes.domain.model.ExtractedBlock;
import org.learningjava.hpes.domain.model.ExtractionRequest;
import org.learningjava.hpes.domain.model.ExtractionResult;
import org.learningjava.hpes.domain.model.batch.BatchResult;
import org.learningjava.hpes.domain.model.batch.FileOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code --hpes.scan.path=<file or dir>} extracts a file or a source tree at start-up and
 * logs a summary; {@code --hpes.scan.report=<file>} also writes the result as JSON.
 * Does nothing when no path is given.
 */
@Component
public class ScanCommand implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    private final ExtractBlocksUseCase extractBlocks;
    private final ExtractRepositoryUseCase extractRepository;
    private final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Value("${hpes.scan.path:}")
    private String scanPath;
    @Value("${hpes.scan.report:}")
    private String reportPath;

    public ScanCommand(ExtractBlocksUseCase extractBlocks, ExtractRepositoryUseCase extractRepository) {
        this.extractBlocks = extractBlocks;
        this.extractRepository = extractRepository;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (scanPath == null || scanPath.isBlank()) {
            log.debug("No hpes.scan.path given, scan skipped");
            return;
        }
        Path target = Path.of(scanPath);
        Object report;
        if (Files.isRegularFile(target)) {
            ExtractionResult result = extractBlocks.extract(
                    ExtractionRequest.of(target.getFileName().toString(), Files.readAllBytes(target)));
            logResult(result);
            report = result;
        } else {
            BatchResult batch = scanDirectory(target);
            for (FileOutcome o : batch.outcomes()) {
                if (o.isCompleted()) {
                    logResult(o.result());
                } else {
                    log.warn("{}: {} ({})", o.path(), o.status(), o.message());
                }
            }
            log.info("Scan of {} done: {}, {} blocks", target, batch.countsByStatus(), batch.stats().totalExtracted());
            report = batch;
        }
        writeReport(report);
    }

    // Ctrl-C cancels the batch; files already extracted are still reported
    private BatchResult scanDirectory(Path target) {
        ExtractRepositoryUseCase.BatchHandle handle = extractRepository.submitDirectory(target);
        Thread cancelOnExit = new Thread(() -> extractRepository.cancel(handle.batchId()), "hpes-scan-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnExit);
        try {
            return handle.result().join();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(cancelOnExit);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, batch {} cancel hook left in place", handle.batchId());
            }
        }
    }

    void setScanPath(String scanPath) {
        this.scanPath = scanPath;
    }

    void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }

    private void logResult(ExtractionResult result) {
        for (ExtractedBlock b : result.blocks()) {
            log.info("{} [{}-{}] {} {} {}", result.sourceFileId(), b.startLine(), b.endLine(),
                    b.language(), b.blockType(), String.format("%.2f", b.confidenceScore()));
        }
        result.warnings().forEach(w -> log.warn("{}: {}", result.sourceFileId(), w));
    }

    private void writeReport(Object report) throws IOException {
        if (reportPath == null || reportPath.isBlank()) {
            return;
        }
        Path out = Path.of(reportPath);
        om.writeValue(out.toFile(), report);
        log.info("Report written to {}", out.toAbsolutePath());
    }
}
