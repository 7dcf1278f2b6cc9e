package io.recoverly.common.dto.recalculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of a payment score batch recalculation.
 *
 * An INTERRUPTED run reports how far it got; passing lastProcessedCustomerId
 * as resume point continues after it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecalculationResultDto {

    private Status status;

    /**
     * Customers visited in this run (updated + unchanged + skipped).
     */
    private int processed;

    private int totalCustomers;
    private int updatedCount;
    private int unchangedCount;

    /**
     * Customers whose recalculation failed and were skipped.
     */
    private List<String> skippedCustomers;

    private String lastProcessedCustomerId;

    private Long durationMs;

    public enum Status {
        COMPLETED,      // every customer visited
        INTERRUPTED     // stopped by cancellation before the end
    }
}
