package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outstanding position of an invoice after allocation.
 * remainingBalance = invoiceAmount - allocatedAmount, never below zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceBalanceDto {

    private String invoiceId;
    private String customerId;
    private BigDecimal invoiceAmount;
    private BigDecimal allocatedAmount;
    private BigDecimal remainingBalance;
    private InvoiceStatus status;
}
