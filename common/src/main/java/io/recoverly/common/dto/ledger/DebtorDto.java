package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One customer with a positive balance on the debtors list.
 *
 * balance = openingBalance + totalInvoices - totalReceipts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebtorDto {

    private String customerId;
    private String customerName;
    private String category;

    private BigDecimal openingBalance;
    private BigDecimal totalInvoices;
    private BigDecimal totalReceipts;
    private BigDecimal balance;

    private int invoiceCount;
    private int receiptCount;
    private LocalDate lastInvoiceDate;
    private LocalDate lastPaymentDate;
}
