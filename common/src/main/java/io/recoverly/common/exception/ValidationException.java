package io.recoverly.common.exception;

/**
 * Exception thrown when validation fails.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message, "LEDGER_ERR_400");
    }

    public ValidationException(String field, String message) {
        super(String.format("Validation failed for '%s': %s", field, message), "LEDGER_ERR_400");
    }

    protected ValidationException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
