package io.recoverly.common.exception;

/**
 * Exception thrown when a receipt would be allocated to an invoice of another customer.
 */
public class CustomerMismatchException extends LedgerException {

    public CustomerMismatchException(String receiptId, String receiptCustomerId,
                                     String invoiceId, String invoiceCustomerId) {
        super(
            String.format("Receipt %s of customer %s cannot be allocated to invoice %s of customer %s",
                    receiptId, receiptCustomerId, invoiceId, invoiceCustomerId),
            "LEDGER_ERR_409"
        );
    }
}
