package io.recoverly.ledger.service;

import io.recoverly.common.dto.recalculation.RecalculationJobDto;
import io.recoverly.common.dto.recalculation.RecalculationResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes payment score batch jobs on the recalculationExecutor thread pool.
 *
 * Kept apart from {@link AsyncRecalculationService} so that the @Async call
 * goes through the Spring proxy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecalculationJobRunner {

    private final PaymentScoreRecalculationService recalculationService;
    private final Clock clock;

    /**
     * Run a queued job, updating it in place.
     *
     * @param job       job record shared with the job store
     * @param cancelled raised by cancelJob; checked before every customer
     */
    @Async("recalculationExecutor")
    public CompletableFuture<Void> run(RecalculationJobDto job, AtomicBoolean cancelled) {
        String jobId = job.getJobId();
        log.info("[{}] Recalculation started. Thread: {}", jobId, Thread.currentThread().getName());

        job.setStatus(RecalculationJobDto.JobStatus.RUNNING);
        job.setStartedAt(LocalDateTime.now(clock));

        try {
            RecalculationResultDto result = recalculationService.recalculateAll(
                    job.getAsOf(), job.getResumeAfterCustomerId(), cancelled::get);

            job.setResult(result);
            job.setStatus(result.getStatus() == RecalculationResultDto.Status.INTERRUPTED
                    ? RecalculationJobDto.JobStatus.INTERRUPTED
                    : RecalculationJobDto.JobStatus.COMPLETED);
            job.setCompletedAt(LocalDateTime.now(clock));

            log.info("[{}] Recalculation {}. Processed: {}/{}, Updated: {}, Unchanged: {}, Skipped: {}, Last: {}",
                    jobId, job.getStatus(),
                    result.getProcessed(),
                    result.getTotalCustomers(),
                    result.getUpdatedCount(),
                    result.getUnchangedCount(),
                    result.getSkippedCustomers().size(),
                    result.getLastProcessedCustomerId());

            return CompletableFuture.completedFuture(null);

        } catch (Exception e) {
            log.error("[{}] Recalculation failed: {}", jobId, e.getMessage(), e);

            job.setStatus(RecalculationJobDto.JobStatus.FAILED);
            job.setErrorMessage(e.getMessage());
            job.setCompletedAt(LocalDateTime.now(clock));

            return CompletableFuture.failedFuture(e);
        }
    }
}
