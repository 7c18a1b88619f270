package org.learningjava.hpes.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /** Validates the candidate regions of a document in parallel. */
    @Bean(name = "regionExecutor")
    public ThreadPoolTaskExecutor regionExecutor(ExtractionProperties props) {
        int threads = props.getValidation().getParallelism();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setThreadNamePrefix("hpes-region-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }

    /**
     * Runs single grammar invocations so a caller can stop waiting at the region
     * timeout. {@code GrammarInvoker} admits at most one task per thread; the queue
     * only absorbs hand-over between a finishing task and the next one.
     */
    @Bean(name = "parserExecutor")
    public ThreadPoolTaskExecutor parserExecutor(ExtractionProperties props) {
        int threads = props.getValidation().getParserThreads();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setQueueCapacity(threads * 2);
        ex.setThreadNamePrefix("hpes-parser-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }

    /** Runs submitted repository batches in the background, a few at a time. */
    @Bean(name = "batchLauncher")
    public ThreadPoolTaskExecutor batchLauncher(ExtractionProperties props) {
        int threads = props.getBatch().getMaxRunning();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setThreadNamePrefix("hpes-batch-run-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }
}
