package org.learningjava.hpes.domain.service.validate;

import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.ExtractionWarning;
import org.learningjava.hpes.domain.model.WarningKind;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.learningjava.hpes.domain.model.parse.ParseTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one grammar adapter call on the parser pool under the region timeout.
 * Callers wait for a free parser slot, so pool load never changes a verdict.
 * Timeouts and crashes come back as warnings, never as exceptions.
 */
@Component
public class GrammarInvoker {

    private static final Logger log = LoggerFactory.getLogger(GrammarInvoker.class);

    public enum Status { CLEAN, SYNTAX_ERROR, TIMED_OUT, FAILED }

    public record Attempt(Status status, ParseReport report, ExtractionWarning warning) {

        public boolean isClean() {
            return status == Status.CLEAN;
        }
    }

    private final AsyncTaskExecutor parserExecutor;
    private final Semaphore slots;
    private final Duration timeout;

    public GrammarInvoker(@Qualifier("parserExecutor") AsyncTaskExecutor parserExecutor,
                          ExtractionProperties props) {
        this.parserExecutor = parserExecutor;
        this.slots = new Semaphore(Math.max(1, props.getValidation().getParserThreads()), true);
        this.timeout = props.getValidation().getRegionTimeout();
    }

    public Attempt invoke(GrammarParserPort grammar, String text, String regionLabel) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return timedOut(grammar, regionLabel);
        }

        ParseBudget budget = ParseBudget.of(timeout);
        // whoever claims first owns the slot: the parse task, or the caller giving up before it started
        AtomicBoolean claimed = new AtomicBoolean();
        Future<ParseReport> future;
        try {
            future = parserExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return grammar.parse(text, budget);
                } finally {
                    slots.release();
                }
            });
        } catch (TaskRejectedException e) {
            // pool shut down or queue full: parse on the caller under the same budget
            log.debug("Parser pool rejected {}, parsing on caller thread", regionLabel);
            claimed.set(true);
            try {
                return inline(grammar, text, budget, regionLabel);
            } finally {
                slots.release();
            }
        }

        try {
            return verdict(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            abandon(future, claimed, budget);
            return timedOut(grammar, regionLabel);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future, claimed, budget);
            return timedOut(grammar, regionLabel);
        } catch (ExecutionException e) {
            return crashed(grammar, regionLabel, e.getCause());
        }
    }

    private Attempt inline(GrammarParserPort grammar, String text, ParseBudget budget, String regionLabel) {
        try {
            return verdict(grammar.parse(text, budget));
        } catch (ParseTimeoutException e) {
            return timedOut(grammar, regionLabel);
        } catch (RuntimeException | StackOverflowError | LinkageError e) {
            return crashed(grammar, regionLabel, e);
        }
    }

    private void abandon(Future<ParseReport> future, AtomicBoolean claimed, ParseBudget budget) {
        budget.cancel();
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            slots.release();
        }
    }

    private static Attempt verdict(ParseReport report) {
        return report.clean()
                ? new Attempt(Status.CLEAN, report, null)
                : new Attempt(Status.SYNTAX_ERROR, report, null);
    }

    private Attempt crashed(GrammarParserPort grammar, String regionLabel, Throwable cause) {
        if (cause instanceof ParseTimeoutException) {
            return timedOut(grammar, regionLabel);
        }
        log.warn("Grammar {} crashed on {}: {}", grammar.grammarId(), regionLabel, cause.toString());
        return new Attempt(Status.FAILED, null, ExtractionWarning.of(WarningKind.PARSE_FAILURE,
                grammar.grammarId() + " parse of " + regionLabel + " failed: " + cause.getClass().getSimpleName()));
    }

    private Attempt timedOut(GrammarParserPort grammar, String regionLabel) {
        log.warn("Grammar {} exceeded {} ms on {}", grammar.grammarId(), timeout.toMillis(), regionLabel);
        return new Attempt(Status.TIMED_OUT, null, ExtractionWarning.of(WarningKind.PARSE_TIMEOUT,
                grammar.grammarId() + " parse of " + regionLabel + " exceeded " + timeout.toMillis() + " ms"));
    }
}
