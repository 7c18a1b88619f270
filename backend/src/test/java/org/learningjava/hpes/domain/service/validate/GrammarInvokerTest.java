package org.learningjava.hpes.domain.service.validate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.config.AsyncConfig;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.WarningKind;
import org.learningjava.hpes.domain.model.parse.ParseTimeoutException;
import org.learningjava.hpes.infrastructure.adapter.out.grammar.PythonGrammarAdapter;
import org.learningjava.hpes.testsupport.SlowPythonGrammar;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class GrammarInvokerTest {

    private ThreadPoolTaskExecutor parserExecutor;
    private GrammarInvoker invoker;

    @BeforeEach
    void setUp() {
        ExtractionProperties props = new ExtractionProperties();
        props.getValidation().setRegionTimeout(Duration.ofMillis(300));
        parserExecutor = new AsyncConfig().parserExecutor(props);
        invoker = new GrammarInvoker(parserExecutor, props);
    }

    @AfterEach
    void tearDown() {
        parserExecutor.shutdown();
    }

    private static GrammarParserPort failingWith(Throwable error) {
        GrammarParserPort grammar = mock(GrammarParserPort.class);
        when(grammar.grammarId()).thenReturn("boom");
        when(grammar.parse(anyString(), any())).thenThrow(error);
        return grammar;
    }

    @Test
    void clean_parse_is_accepted_without_warning() {
        GrammarInvoker.Attempt a = invoker.invoke(new PythonGrammarAdapter(), "x = 1\nprint(x)\n", "t lines 1-2");

        assertEquals(GrammarInvoker.Status.CLEAN, a.status());
        assertTrue(a.isClean());
        assertTrue(a.report().nodeCount() > 0);
        assertNull(a.warning());
    }

    @Test
    void syntax_error_carries_report_but_no_warning() {
        GrammarInvoker.Attempt a = invoker.invoke(new PythonGrammarAdapter(), "def (:\n", "t lines 1-1");

        assertEquals(GrammarInvoker.Status.SYNTAX_ERROR, a.status());
        assertFalse(a.report().clean());
        assertNull(a.warning());
    }

    @Test
    void slow_parse_times_out_and_is_recovered() {
        long start = System.nanoTime();
        GrammarInvoker.Attempt a = invoker.invoke(new SlowPythonGrammar(), "x = 1 " + SlowPythonGrammar.MARKER, "t lines 1-1");
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertEquals(GrammarInvoker.Status.TIMED_OUT, a.status());
        assertEquals(WarningKind.PARSE_TIMEOUT, a.warning().kind());
        assertTrue(elapsedMillis < 5_000, "waited " + elapsedMillis + " ms");
    }

    @Test
    void budget_exhaustion_inside_grammar_counts_as_timeout() {
        GrammarInvoker.Attempt a = invoker.invoke(failingWith(new ParseTimeoutException("budget")), "x", "t");
        assertEquals(GrammarInvoker.Status.TIMED_OUT, a.status());
        assertEquals(WarningKind.PARSE_TIMEOUT, a.warning().kind());
    }

    @Test
    void crashing_grammar_is_a_parse_failure() {
        GrammarInvoker.Attempt a = invoker.invoke(failingWith(new IllegalStateException("bug")), "x", "t");

        assertEquals(GrammarInvoker.Status.FAILED, a.status());
        assertEquals(WarningKind.PARSE_FAILURE, a.warning().kind());
        assertTrue(a.warning().message().contains("IllegalStateException"));
    }

    @Test
    void stack_overflow_is_contained() {
        GrammarInvoker.Attempt a = invoker.invoke(failingWith(new StackOverflowError()), "x", "t");
        assertEquals(GrammarInvoker.Status.FAILED, a.status());
        assertTrue(a.warning().message().contains("StackOverflowError"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void rejected_submission_parses_on_caller_thread() {
        AsyncTaskExecutor full = mock(AsyncTaskExecutor.class);
        when(full.submit(any(Callable.class))).thenThrow(new TaskRejectedException("full"));
        GrammarInvoker rejecting = new GrammarInvoker(full, new ExtractionProperties());

        GrammarInvoker.Attempt a = rejecting.invoke(new PythonGrammarAdapter(), "x = 1\n", "t");

        assertEquals(GrammarInvoker.Status.CLEAN, a.status());
        assertNull(a.warning());
    }

    @Test
    void busy_pool_makes_callers_wait_instead_of_failing() throws Exception {
        ExtractionProperties props = new ExtractionProperties();
        props.getValidation().setParserThreads(2);
        props.getValidation().setRegionTimeout(Duration.ofSeconds(30));
        ThreadPoolTaskExecutor small = new AsyncConfig().parserExecutor(props);
        GrammarInvoker busy = new GrammarInvoker(small, props);
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<GrammarInvoker.Status>> statuses = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                statuses.add(callers.submit(() -> busy.invoke(
                        new PythonGrammarAdapter(), "def f(x):\n    return x + 1\n", "t lines 1-2").status()));
            }
            for (Future<GrammarInvoker.Status> status : statuses) {
                assertEquals(GrammarInvoker.Status.CLEAN, status.get(60, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
            small.shutdown();
        }
    }

    @Test
    void timed_out_parse_gives_its_slot_back() {
        ExtractionProperties props = new ExtractionProperties();
        props.getValidation().setParserThreads(1);
        props.getValidation().setRegionTimeout(Duration.ofMillis(200));
        ThreadPoolTaskExecutor single = new AsyncConfig().parserExecutor(props);
        GrammarInvoker one = new GrammarInvoker(single, props);
        try {
            assertEquals(GrammarInvoker.Status.TIMED_OUT,
                    one.invoke(new SlowPythonGrammar(), "x = 1 " + SlowPythonGrammar.MARKER, "t").status());
            assertEquals(GrammarInvoker.Status.CLEAN,
                    one.invoke(new PythonGrammarAdapter(), "x = 1\n", "t").status());
        } finally {
            single.shutdown();
        }
    }
}
