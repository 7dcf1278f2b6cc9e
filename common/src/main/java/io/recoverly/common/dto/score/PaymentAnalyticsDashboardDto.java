package io.recoverly.common.dto.score;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payment analytics dashboard: segments plus an overall summary.
 * Customers without payments (no classification) are excluded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAnalyticsDashboardDto {

    private List<SegmentSummaryDto> segments;

    private int totalCustomers;
    private BigDecimal avgOnTimeRate;
    private BigDecimal totalOutstanding;
    private BigDecimal avgPaymentScore;
}
