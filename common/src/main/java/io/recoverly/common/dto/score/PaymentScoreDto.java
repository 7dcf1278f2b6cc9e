package io.recoverly.common.dto.score;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Payment behavior record of a customer.
 *
 * Written only by the classifier. onTimeRate, avgDelayDays, paymentScore and
 * classification are null until the customer's first payment.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaymentScoreDto {

    private String customerId;

    private int totalPayments;
    private int onTimeCount;
    private int lateCount;

    private BigDecimal onTimeRate;      // %
    private BigDecimal avgDelayDays;
    private Integer paymentScore;       // 0-100
    private PaymentClassification classification;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate calculatedAsOf;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime lastCalculatedAt;

    /**
     * Compares the calculated fields only, ignoring calculation timestamps.
     */
    public boolean sameScoreAs(PaymentScoreDto other) {
        if (other == null) {
            return false;
        }
        return totalPayments == other.totalPayments
                && onTimeCount == other.onTimeCount
                && lateCount == other.lateCount
                && compareNullable(onTimeRate, other.onTimeRate)
                && compareNullable(avgDelayDays, other.avgDelayDays)
                && Objects.equals(paymentScore, other.paymentScore)
                && classification == other.classification;
    }

    private static boolean compareNullable(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
