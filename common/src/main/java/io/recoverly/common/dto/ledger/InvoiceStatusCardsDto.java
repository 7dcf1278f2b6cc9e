package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Dashboard counters grouping invoices by due/paid state.
 *
 * Grace period: days after the due date that still count as on time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceStatusCardsDto {

    private Card upcoming;
    private Card dueToday;
    private Card inGrace;
    private Card overdue;
    private Card paidOnTime;
    private Card paidLate;
    private Integer graceDays;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Card {
        private int count;
        private BigDecimal totalAmount;
    }
}
