package io.recoverly.common.exception;

/**
 * Exception thrown when the backing store (Firestore) fails a read or write.
 */
public class StorageException extends LedgerException {

    private final String operation;

    public StorageException(String operation, String message, Throwable cause) {
        super(
            String.format("Storage operation '%s' failed: %s", operation, message),
            "LEDGER_ERR_502",
            cause
        );
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
