package io.recoverly.common.dto.recalculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * DTO for tracking asynchronous payment score recalculation jobs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecalculationJobDto {

    /**
     * Unique job identifier (UUID).
     */
    private String jobId;

    private JobStatus status;

    /**
     * Source that triggered the job (e.g., "manual", "scheduler").
     */
    private String source;

    private LocalDate asOf;

    /**
     * Customer after which the run started (null = from the beginning).
     */
    private String resumeAfterCustomerId;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /**
     * Batch result (present once COMPLETED or INTERRUPTED).
     */
    private RecalculationResultDto result;

    /**
     * Error message (only present if status = FAILED).
     */
    private String errorMessage;

    public enum JobStatus {
        PENDING,        // Queued, not yet started
        RUNNING,        // Currently processing
        COMPLETED,      // Every customer visited
        INTERRUPTED,    // Cancelled, resumable
        FAILED          // Error occurred
    }
}
