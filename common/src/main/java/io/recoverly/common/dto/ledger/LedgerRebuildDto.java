package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result of replaying every receipt of a customer against its invoices.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerRebuildDto {

    private String customerId;
    private List<AllocationDto> allocations;
    private List<InvoiceBalanceDto> invoiceBalances;

    /**
     * receiptId -> unallocated amount, only receipts with a positive remainder.
     */
    private Map<String, BigDecimal> unallocatedByReceipt;
}
