package com.example.statements.application.service;

import com.example.statements.application.exception.BatchRequestValidationException;
import com.example.statements.domain.model.BatchItemResult;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.domain.model.StatementSource;
import com.example.statements.infrastructure.config.StatementProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many statements through the extraction service on a bounded worker pool.
 * Each document is independent: a timeout or a worker failure turns into a {@code PARSE_ERROR} for that
 * document only, and results come back in input order.
 */
@Service
public class StatementBatchService implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(StatementBatchService.class);

    private final StatementExtractionService extractionService;
    private final ExecutorService executor;
    private final Duration timeout;

    @Autowired
    public StatementBatchService(StatementExtractionService extractionService, StatementProperties properties) {
        this(extractionService, properties.batch().poolSize(), properties.batch().timeout());
    }

    public StatementBatchService(StatementExtractionService extractionService, int poolSize, Duration timeout) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Batch pool size must be positive: " + poolSize);
        }
        this.extractionService = extractionService;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
    }

    /**
     * Processes every statement of the batch.
     *
     * @param sources statements to process
     * @return one result per source, in input order
     * @throws BatchRequestValidationException when the batch is empty
     */
    public List<BatchItemResult> process(List<StatementSource> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new BatchRequestValidationException("A batch must contain at least one statement.");
        }
        List<CompletableFuture<BatchItemResult>> futures = sources.stream()
                .map(this::submit)
                .toList();
        List<BatchItemResult> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        long succeeded = results.stream().filter(result -> result.response().isSuccess()).count();
        log.info("Processed batch of {} statements: {} succeeded, {} failed",
                results.size(), succeeded, results.size() - succeeded);
        return results;
    }

    private CompletableFuture<BatchItemResult> submit(StatementSource source) {
        String filename = source != null ? source.filename() : null;
        return CompletableFuture.supplyAsync(() -> extractionService.extract(source), executor)
                .completeOnTimeout(timedOut(filename), timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    log.error("Worker failed while processing statement {}", filename, ex);
                    return parseError("Statement could not be processed.");
                })
                .thenApply(response -> new BatchItemResult(filename, response));
    }

    private StatementResponse timedOut(String filename) {
        return parseError("Processing of " + filename + " timed out after " + timeout.toMillis() + " ms.");
    }

    private static StatementResponse parseError(String message) {
        return StatementResponse.error(new ErrorRecord(ErrorCode.PARSE_ERROR, message));
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "statement-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
