package io.recoverly.common.dto.credit;

import java.math.BigDecimal;

/**
 * Dashboard bands for credit utilization percentage.
 */
public enum UtilizationBand {
    NO_LIMIT,       // credit limit zero or missing, percentage undefined
    NOT_UTILIZED,   // 0% or less
    LOW,            // up to 25%
    MODERATE,       // up to 50%
    HIGH,           // up to 75%
    CRITICAL,       // up to 100%
    OVER_UTILIZED;  // above 100%

    private static final BigDecimal QUARTER = BigDecimal.valueOf(25);
    private static final BigDecimal HALF = BigDecimal.valueOf(50);
    private static final BigDecimal THREE_QUARTERS = BigDecimal.valueOf(75);
    private static final BigDecimal FULL = BigDecimal.valueOf(100);

    public static UtilizationBand of(BigDecimal utilizationPct) {
        if (utilizationPct == null) {
            return NO_LIMIT;
        }
        if (utilizationPct.signum() <= 0) {
            return NOT_UTILIZED;
        }
        if (utilizationPct.compareTo(QUARTER) <= 0) {
            return LOW;
        }
        if (utilizationPct.compareTo(HALF) <= 0) {
            return MODERATE;
        }
        if (utilizationPct.compareTo(THREE_QUARTERS) <= 0) {
            return HIGH;
        }
        if (utilizationPct.compareTo(FULL) <= 0) {
            return CRITICAL;
        }
        return OVER_UTILIZED;
    }
}
