package io.recoverly.ledger.service;

import io.recoverly.common.dto.interest.InterestBreakdownDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.profit.ProfitabilityDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ProfitabilityServiceTest {

    private ProfitabilityService service;

    @BeforeEach
    void setUp() {
        service = new ProfitabilityService();
    }

    @Test
    void resolveProfitability_ShouldDeductInterestFromGrossProfit() {
        ProfitabilityDto result = service.resolveProfitability(invoice("10000.00", "7000.00"), interest("147.95"));

        assertTrue(result.isCostBasisKnown());
        assertEquals(new BigDecimal("3000.00"), result.getGrossProfit());
        assertEquals(new BigDecimal("2852.05"), result.getFinalGrossProfit());
        assertEquals(new BigDecimal("28.52"), result.getFinalGrossProfitPct());
    }

    @Test
    void resolveProfitability_ShouldKeepNegativeSign() {
        ProfitabilityDto result = service.resolveProfitability(invoice("10000.00", "9900.00"), interest("147.95"));

        assertEquals(new BigDecimal("-47.95"), result.getFinalGrossProfit());
        assertEquals(new BigDecimal("-0.48"), result.getFinalGrossProfitPct());
    }

    @Test
    void resolveProfitability_ShouldFlagMissingCostBasis() {
        ProfitabilityDto result = service.resolveProfitability(invoice("10000.00", null), interest("0.00"));

        assertFalse(result.isCostBasisKnown());
        assertNull(result.getCostBasis());
        assertEquals(new BigDecimal("10000.00"), result.getGrossProfit());
        assertEquals(new BigDecimal("100.00"), result.getFinalGrossProfitPct());
    }

    @Test
    void resolveProfitability_ShouldLeavePercentageUndefinedForZeroAmount() {
        ProfitabilityDto result = service.resolveProfitability(invoice("0.00", "0.00"), interest("0.00"));

        assertEquals(new BigDecimal("0.00"), result.getFinalGrossProfit());
        assertNull(result.getFinalGrossProfitPct());
    }

    private InvoiceDto invoice(String amount, String cost) {
        return InvoiceDto.builder()
                .id("inv-1")
                .customerId("cust-1")
                .invoiceAmount(new BigDecimal(amount))
                .costBasis(cost != null ? new BigDecimal(cost) : null)
                .build();
    }

    private InterestBreakdownDto interest(String total) {
        return InterestBreakdownDto.builder()
                .invoiceId("inv-1")
                .totalInterest(new BigDecimal(total))
                .build();
    }
}
