package io.recoverly.common.exception;

import lombok.Getter;

/**
 * Base exception for all receivables ledger business exceptions.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final String errorCode;

    public LedgerException(String message) {
        super(message);
        this.errorCode = "LEDGER_ERR_001";
    }

    public LedgerException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
