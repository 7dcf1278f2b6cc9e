package io.recoverly.common.dto.interest;

/**
 * How opening-balance interest combines with invoice interest for one customer.
 */
public enum InterestCombinationPolicy {
    SUM,        // opening-balance interest + invoice interest
    COMPOUND    // opening-balance rate also accrues on accumulated invoice interest
}
