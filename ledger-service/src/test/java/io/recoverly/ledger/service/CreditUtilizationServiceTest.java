package io.recoverly.ledger.service;

import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.dto.credit.UtilizationBand;
import io.recoverly.common.dto.credit.UtilizationDto;
import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.InvoiceBalanceDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreditUtilizationServiceTest {

    private CreditUtilizationService service;

    @BeforeEach
    void setUp() {
        service = new CreditUtilizationService(new PaymentAllocationService());
    }

    @Test
    void computeUtilization_ShouldLeavePercentageUndefinedWithoutLimit() {
        UtilizationDto result = service.computeUtilization(profile("0.00", null), List.of(balance("3000.00")));

        assertNull(result.getUtilizationPct());
        assertEquals(UtilizationBand.NO_LIMIT, result.getBand());
        assertEquals(new BigDecimal("3000.00"), result.getUtilizedLimit());
        assertEquals(new BigDecimal("-3000.00"), result.getAvailableLimit());
    }

    @Test
    void computeUtilization_ShouldCountOpeningBalanceOnce() {
        UtilizationDto result = service.computeUtilization(profile("10000.00", "1000.00"),
                List.of(balance("3000.00"), balance("1000.00")));

        assertEquals(new BigDecimal("4000.00"), result.getOutstandingInvoices());
        assertEquals(new BigDecimal("1000.00"), result.getOpeningBalance());
        assertEquals(new BigDecimal("5000.00"), result.getUtilizedLimit());
        assertEquals(new BigDecimal("5000.00"), result.getAvailableLimit());
        assertEquals(new BigDecimal("50.00"), result.getUtilizationPct());
        assertEquals(UtilizationBand.MODERATE, result.getBand());
    }

    @Test
    void computeUtilization_ShouldAllowOverLimit() {
        UtilizationDto result = service.computeUtilization(profile("1000.00", null), List.of(balance("1500.00")));

        assertEquals(new BigDecimal("-500.00"), result.getAvailableLimit());
        assertEquals(new BigDecimal("150.00"), result.getUtilizationPct());
        assertEquals(UtilizationBand.OVER_UTILIZED, result.getBand());
    }

    @Test
    void computeUtilization_ShouldDeriveBalancesFromAllocations() {
        InvoiceDto invoice = InvoiceDto.builder()
                .id("inv-1")
                .customerId("cust-1")
                .invoiceDate(LocalDate.of(2025, 1, 1))
                .invoiceAmount(new BigDecimal("2000.00"))
                .build();
        AllocationDto paid = AllocationDto.builder()
                .id("rcpt-1:inv-1")
                .receiptId("rcpt-1")
                .invoiceId("inv-1")
                .customerId("cust-1")
                .paymentDate(LocalDate.of(2025, 1, 5))
                .allocatedAmount(new BigDecimal("500.00"))
                .build();

        UtilizationDto result = service.computeUtilization(profile("6000.00", null), List.of(invoice), List.of(paid));

        assertEquals(new BigDecimal("1500.00"), result.getUtilizedLimit());
        assertEquals(new BigDecimal("25.00"), result.getUtilizationPct());
        assertEquals(UtilizationBand.LOW, result.getBand());
    }

    @Test
    void band_ShouldFollowThresholds() {
        assertEquals(UtilizationBand.NOT_UTILIZED, UtilizationBand.of(new BigDecimal("0.00")));
        assertEquals(UtilizationBand.LOW, UtilizationBand.of(new BigDecimal("25.00")));
        assertEquals(UtilizationBand.MODERATE, UtilizationBand.of(new BigDecimal("25.01")));
        assertEquals(UtilizationBand.HIGH, UtilizationBand.of(new BigDecimal("75.00")));
        assertEquals(UtilizationBand.CRITICAL, UtilizationBand.of(new BigDecimal("100.00")));
        assertEquals(UtilizationBand.OVER_UTILIZED, UtilizationBand.of(new BigDecimal("100.01")));
        assertEquals(UtilizationBand.NO_LIMIT, UtilizationBand.of(null));
    }

    @Test
    void applicableOpeningBalance_ShouldFallBackToCategory() {
        CustomerCreditProfileDto categoryOnly = CustomerCreditProfileDto.builder()
                .customerId("cust-1")
                .categoryOpeningBalance(new BigDecimal("750.00"))
                .build();

        assertEquals(new BigDecimal("750.00"), CreditUtilizationService.applicableOpeningBalance(categoryOnly));
        assertEquals(new BigDecimal("0.00"), CreditUtilizationService.applicableOpeningBalance(null));
    }

    private CustomerCreditProfileDto profile(String limit, String customerOpening) {
        return CustomerCreditProfileDto.builder()
                .customerId("cust-1")
                .customerName("Acme Trading")
                .category("Beta")
                .creditLimit(new BigDecimal(limit))
                .customerOpeningBalance(customerOpening != null ? new BigDecimal(customerOpening) : null)
                .build();
    }

    private InvoiceBalanceDto balance(String remaining) {
        return InvoiceBalanceDto.builder()
                .invoiceId("inv-" + remaining)
                .customerId("cust-1")
                .remainingBalance(new BigDecimal(remaining))
                .build();
    }
}
