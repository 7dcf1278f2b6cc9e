package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of allocating a single receipt.
 *
 * receiptAmount - allocatedAmount == unallocatedAmount. A positive
 * unallocatedAmount is surfaced to the operator, never absorbed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationResultDto {

    private String receiptId;
    private String customerId;
    private BigDecimal receiptAmount;
    private BigDecimal allocatedAmount;
    private BigDecimal unallocatedAmount;

    private List<AllocationDto> allocations;

    /**
     * Balances of every candidate invoice after this allocation.
     */
    private List<InvoiceBalanceDto> invoiceBalances;
}
