package io.recoverly.common.dto.profit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Profitability of an invoice after interest lost to late payment.
 *
 * finalGrossProfit keeps its sign; finalGrossProfitPct is null for a zero invoice amount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfitabilityDto {

    private String invoiceId;
    private BigDecimal invoiceAmount;
    private BigDecimal costBasis;
    private boolean costBasisKnown;

    private BigDecimal grossProfit;
    private BigDecimal totalInterest;
    private BigDecimal finalGrossProfit;
    private BigDecimal finalGrossProfitPct;
}
