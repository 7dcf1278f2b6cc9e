package io.recoverly.common.dto.score;

import java.math.BigDecimal;

/**
 * Payment-behavior segment, a step function of the on-time rate.
 */
public enum PaymentClassification {
    STAR,       // >= 80% on-time
    REGULAR,    // 50-79%
    RISKY,      // 30-49%
    CRITICAL;   // < 30%

    private static final BigDecimal STAR_THRESHOLD = BigDecimal.valueOf(80);
    private static final BigDecimal REGULAR_THRESHOLD = BigDecimal.valueOf(50);
    private static final BigDecimal RISKY_THRESHOLD = BigDecimal.valueOf(30);

    /**
     * @return classification, or null when the rate is undefined (no payments yet)
     */
    public static PaymentClassification of(BigDecimal onTimeRate) {
        if (onTimeRate == null) {
            return null;
        }
        if (onTimeRate.compareTo(STAR_THRESHOLD) >= 0) {
            return STAR;
        }
        if (onTimeRate.compareTo(REGULAR_THRESHOLD) >= 0) {
            return REGULAR;
        }
        if (onTimeRate.compareTo(RISKY_THRESHOLD) >= 0) {
            return RISKY;
        }
        return CRITICAL;
    }
}
