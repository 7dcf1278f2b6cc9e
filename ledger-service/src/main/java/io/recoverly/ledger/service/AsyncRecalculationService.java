package io.recoverly.ledger.service;

import io.recoverly.common.dto.recalculation.RecalculationJobDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background payment score recalculation with job tracking.
 *
 * Jobs are tracked in memory for status polling and cancellation. A job that
 * is cancelled stops INTERRUPTED; its result names the last processed
 * customer, which a new job can resume after.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncRecalculationService {

    private final RecalculationJobRunner jobRunner;
    private final Clock clock;

    private final Map<String, RecalculationJobDto> jobStore = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    /**
     * Queue a recalculation of every customer.
     *
     * @param source                what triggered the job (e.g. "scheduler", "event")
     * @param asOf                  reference date of the scores
     * @param resumeAfterCustomerId resume point of an interrupted run, or null
     * @return job ID for status tracking
     */
    public synchronized String triggerRecalculation(String source, LocalDate asOf, String resumeAfterCustomerId) {
        Optional<RecalculationJobDto> active = findActiveJob();
        if (active.isPresent()) {
            log.info("[{}] Recalculation already {}, not starting another (source: {})",
                    active.get().getJobId(), active.get().getStatus(), source);
            return active.get().getJobId();
        }

        String jobId = UUID.randomUUID().toString();
        RecalculationJobDto job = RecalculationJobDto.builder()
                .jobId(jobId)
                .status(RecalculationJobDto.JobStatus.PENDING)
                .source(source)
                .asOf(asOf)
                .resumeAfterCustomerId(resumeAfterCustomerId)
                .createdAt(LocalDateTime.now(clock))
                .build();

        AtomicBoolean cancelled = new AtomicBoolean(false);
        jobStore.put(jobId, job);
        cancelFlags.put(jobId, cancelled);

        log.info("[{}] Recalculation job created. Source: {}, as of: {}", jobId, source, asOf);

        jobRunner.run(job, cancelled);
        return jobId;
    }

    /**
     * Ask a pending or running job to stop after its current customer.
     *
     * @return false when the job is unknown or already finished
     */
    public boolean cancelJob(String jobId) {
        RecalculationJobDto job = jobStore.get(jobId);
        AtomicBoolean flag = cancelFlags.get(jobId);
        if (job == null || flag == null || !isActive(job)) {
            return false;
        }
        flag.set(true);
        log.info("[{}] Cancellation requested", jobId);
        return true;
    }

    public Optional<RecalculationJobDto> getJobStatus(String jobId) {
        return Optional.ofNullable(jobStore.get(jobId));
    }

    /**
     * Drop finished jobs older than maxAgeMinutes.
     */
    public void cleanupOldJobs(int maxAgeMinutes) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(maxAgeMinutes);
        int removed = 0;

        for (Map.Entry<String, RecalculationJobDto> entry : jobStore.entrySet()) {
            RecalculationJobDto job = entry.getValue();
            if (job.getCompletedAt() != null && job.getCompletedAt().isBefore(cutoff)) {
                jobStore.remove(entry.getKey());
                cancelFlags.remove(entry.getKey());
                removed++;
            }
        }

        if (removed > 0) {
            log.info("Cleaned up {} old recalculation jobs", removed);
        }
    }

    // ==================== HELPER METHODS ====================

    private Optional<RecalculationJobDto> findActiveJob() {
        return jobStore.values().stream()
                .filter(this::isActive)
                .findFirst();
    }

    private boolean isActive(RecalculationJobDto job) {
        return job.getStatus() == RecalculationJobDto.JobStatus.PENDING
                || job.getStatus() == RecalculationJobDto.JobStatus.RUNNING;
    }
}
