package io.recoverly.common.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when a monetary input is zero or negative.
 */
public class InvalidAmountException extends ValidationException {

    private final BigDecimal amount;

    public InvalidAmountException(String field, BigDecimal amount) {
        super(String.format("Amount for '%s' must be positive, got: %s", field, amount), "LEDGER_ERR_422", null);
        this.amount = amount;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
