package io.recoverly.ledger.service;

import io.recoverly.common.dto.interest.InterestBreakdownDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.profit.ProfitabilityDto;
import io.recoverly.common.util.AmountUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Final gross profit of an invoice once interest lost to late payment is deducted.
 *
 * grossProfit      = invoiceAmount - costBasis (missing cost: grossProfit = invoiceAmount)
 * finalGrossProfit = grossProfit - totalInterest (may be negative)
 * finalGrossProfitPct = finalGrossProfit / invoiceAmount x 100, null for a zero amount
 */
@Slf4j
@Service
public class ProfitabilityService {

    public ProfitabilityDto resolveProfitability(InvoiceDto invoice, InterestBreakdownDto breakdown) {
        BigDecimal invoiceAmount = AmountUtils.nullToZero(invoice.getInvoiceAmount());
        boolean costKnown = invoice.getCostBasis() != null;
        BigDecimal costBasis = AmountUtils.nullToZero(invoice.getCostBasis());

        BigDecimal grossProfit = AmountUtils.round(invoiceAmount.subtract(costBasis));
        BigDecimal totalInterest = breakdown != null
                ? AmountUtils.nullToZero(breakdown.getTotalInterest())
                : AmountUtils.zero();
        BigDecimal finalGrossProfit = AmountUtils.round(grossProfit.subtract(totalInterest));

        if (!costKnown) {
            log.debug("Invoice {} has no cost basis, gross profit equals invoice amount", invoice.getId());
        }

        return ProfitabilityDto.builder()
                .invoiceId(invoice.getId())
                .invoiceAmount(invoiceAmount)
                .costBasis(costKnown ? costBasis : null)
                .costBasisKnown(costKnown)
                .grossProfit(grossProfit)
                .totalInterest(totalInterest)
                .finalGrossProfit(finalGrossProfit)
                .finalGrossProfitPct(AmountUtils.percentage(finalGrossProfit, invoiceAmount))
                .build();
    }
}
