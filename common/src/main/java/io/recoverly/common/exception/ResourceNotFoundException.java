package io.recoverly.common.exception;

/**
 * Exception thrown when a ledger entity cannot be found.
 */
public class ResourceNotFoundException extends LedgerException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(String.format("%s not found with identifier: %s", resourceType, identifier), "LEDGER_ERR_404");
    }
}
