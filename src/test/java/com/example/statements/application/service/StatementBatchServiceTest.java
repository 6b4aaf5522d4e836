package com.example.statements.application.service;

import com.example.statements.application.exception.BatchRequestValidationException;
import com.example.statements.domain.model.BatchItemResult;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.domain.model.StatementSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the batch runner. The extraction service is mocked so timing can be controlled.
 */
class StatementBatchServiceTest {

    private static final StatementResponse FAILED =
            StatementResponse.error(new ErrorRecord(ErrorCode.MISSING_BALANCE, "Balance missing."));

    private final StatementExtractionService extractionService = mock(StatementExtractionService.class);
    private final CountDownLatch release = new CountDownLatch(1);
    private StatementBatchService batchService;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (batchService != null) {
            batchService.destroy();
        }
    }

    @Test
    void resultsComeBackInInputOrder() {
        when(extractionService.extract(any(StatementSource.class)))
                .thenAnswer(invocation -> {
                    StatementSource source = invocation.getArgument(0);
                    return StatementResponse.error(new ErrorRecord(ErrorCode.PARSE_ERROR, source.filename()));
                });
        batchService = new StatementBatchService(extractionService, 3, Duration.ofSeconds(5));

        List<BatchItemResult> results = batchService.process(List.of(
                new StatementSource("a", "a.pdf"),
                new StatementSource("b", "b.pdf"),
                new StatementSource("c", "c.pdf"),
                new StatementSource("d", "d.pdf")));

        assertThat(results).extracting(BatchItemResult::filename).containsExactly("a.pdf", "b.pdf", "c.pdf", "d.pdf");
        assertThat(results).extracting(result -> result.response().error().message())
                .containsExactly("a.pdf", "b.pdf", "c.pdf", "d.pdf");
    }

    @Test
    void workerFailureOnlyAffectsItsDocument() {
        when(extractionService.extract(any(StatementSource.class)))
                .thenAnswer(invocation -> {
                    StatementSource source = invocation.getArgument(0);
                    if (source.filename().equals("bad.pdf")) {
                        throw new IllegalStateException("boom");
                    }
                    return FAILED;
                });
        batchService = new StatementBatchService(extractionService, 2, Duration.ofSeconds(5));

        List<BatchItemResult> results = batchService.process(List.of(
                new StatementSource("ok", "ok.pdf"),
                new StatementSource("bad", "bad.pdf")));

        assertThat(results.get(0).response().error().code()).isEqualTo(ErrorCode.MISSING_BALANCE);
        assertThat(results.get(1).response().error().code()).isEqualTo(ErrorCode.PARSE_ERROR);
    }

    @Test
    void slowDocumentTimesOutAsParseError() {
        when(extractionService.extract(any(StatementSource.class)))
                .thenAnswer(invocation -> {
                    StatementSource source = invocation.getArgument(0);
                    if (source.filename().equals("slow.pdf")) {
                        release.await();
                    }
                    return FAILED;
                });
        batchService = new StatementBatchService(extractionService, 2, Duration.ofMillis(200));

        List<BatchItemResult> results = batchService.process(List.of(
                new StatementSource("slow", "slow.pdf"),
                new StatementSource("fast", "fast.pdf")));

        assertThat(results.get(0).response().error().code()).isEqualTo(ErrorCode.PARSE_ERROR);
        assertThat(results.get(0).response().error().message()).contains("timed out");
        assertThat(results.get(1).response().error().code()).isEqualTo(ErrorCode.MISSING_BALANCE);
    }

    @Test
    void emptyBatchIsRejected() {
        batchService = new StatementBatchService(extractionService, 1, Duration.ofSeconds(1));

        assertThrows(BatchRequestValidationException.class, () -> batchService.process(List.of()));
    }
}
