package io.recoverly.common.dto.ledger;

public enum LedgerEntryType {
    INVOICE,    // Debit
    RECEIPT     // Credit
}
