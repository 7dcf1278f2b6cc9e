package io.recoverly.common.dto.score;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One classification segment on the payment analytics dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentSummaryDto {

    private PaymentClassification classification;
    private int customerCount;
    private BigDecimal totalOutstanding;
    private BigDecimal avgPaymentScore;
}
