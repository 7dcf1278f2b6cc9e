package io.recoverly.common.dto.credit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Credit utilization of a customer.
 *
 * utilizedLimit = outstanding invoice balances + opening balance (once).
 * availableLimit may be negative. utilizationPct is null without a credit limit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UtilizationDto {

    private String customerId;
    private String customerName;
    private String category;

    private BigDecimal creditLimit;
    private BigDecimal outstandingInvoices;
    private BigDecimal openingBalance;
    private BigDecimal utilizedLimit;
    private BigDecimal availableLimit;
    private BigDecimal utilizationPct;
    private UtilizationBand band;
}
