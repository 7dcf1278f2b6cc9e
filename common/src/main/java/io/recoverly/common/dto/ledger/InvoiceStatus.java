package io.recoverly.common.dto.ledger;

/**
 * Payment status of an invoice. Always derived from its allocations, never set by callers.
 */
public enum InvoiceStatus {
    UNPAID,     // Nothing allocated
    PARTIAL,    // Some but not all of the amount allocated
    PAID        // Fully allocated
}
