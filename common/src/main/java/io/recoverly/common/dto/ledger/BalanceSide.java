package io.recoverly.common.dto.ledger;

import java.math.BigDecimal;

/**
 * Side of a ledger balance: debit when the customer owes, credit when they have paid in excess.
 */
public enum BalanceSide {
    DR,
    CR;

    /**
     * Zero counts as debit.
     */
    public static BalanceSide of(BigDecimal signedBalance) {
        return signedBalance == null || signedBalance.signum() >= 0 ? DR : CR;
    }
}
