package io.recoverly.ledger.service;

import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.dto.credit.UtilizationBand;
import io.recoverly.common.dto.credit.UtilizationDto;
import io.recoverly.common.dto.interest.CustomerInterestSummaryDto;
import io.recoverly.common.dto.interest.InterestBreakdownDto;
import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.BalanceSide;
import io.recoverly.common.dto.ledger.DebtorDto;
import io.recoverly.common.dto.ledger.DebtorsListDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.ledger.InvoiceStatusCardsDto;
import io.recoverly.common.dto.ledger.LedgerEntryType;
import io.recoverly.common.dto.ledger.LedgerStatementDto;
import io.recoverly.common.dto.ledger.ReceiptDto;
import io.recoverly.common.dto.profit.ProfitabilityDto;
import io.recoverly.common.exception.ResourceNotFoundException;
import io.recoverly.common.exception.ValidationException;
import io.recoverly.ledger.config.LedgerProperties;
import io.recoverly.ledger.repository.AllocationRepository;
import io.recoverly.ledger.repository.CustomerCreditProfileRepository;
import io.recoverly.ledger.repository.InvoiceRepository;
import io.recoverly.ledger.repository.ReceiptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerQueryServiceTest {

    private static final LocalDate DAY_ZERO = LocalDate.of(2025, 1, 1);

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private ReceiptRepository receiptRepository;

    @Mock
    private AllocationRepository allocationRepository;

    @Mock
    private CustomerCreditProfileRepository profileRepository;

    private LedgerQueryService service;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        PaymentAllocationService allocationService = new PaymentAllocationService();
        service = new LedgerQueryService(invoiceRepository, receiptRepository, allocationRepository, profileRepository,
                allocationService, new InterestCalculationService(properties), new ProfitabilityService(),
                new CreditUtilizationService(allocationService), properties);
    }

    @Test
    void getInterestBreakdown_ShouldUseCustomerRateWhenInvoiceHasNone() {
        when(invoiceRepository.findById("inv-1")).thenReturn(Optional.of(invoice("inv-1", DAY_ZERO, "10000.00")));
        when(profileRepository.findById("cust-1")).thenReturn(Optional.of(profile("18", null)));
        when(allocationRepository.findByInvoiceId("inv-1"))
                .thenReturn(List.of(allocation("inv-1", DAY_ZERO.plusDays(30), "10000.00")));

        InterestBreakdownDto breakdown = service.getInterestBreakdown("inv-1", DAY_ZERO.plusDays(60));

        assertEquals(new BigDecimal("147.95"), breakdown.getTotalInterest());
        assertEquals(new BigDecimal("0.00"), breakdown.getUnpaidInterest());
    }

    @Test
    void getProfitability_ShouldDeductRecomputedInterest() {
        InvoiceDto invoice = invoice("inv-1", DAY_ZERO, "10000.00").toBuilder()
                .costBasis(new BigDecimal("7000.00"))
                .build();
        when(invoiceRepository.findById("inv-1")).thenReturn(Optional.of(invoice));
        when(profileRepository.findById("cust-1")).thenReturn(Optional.of(profile("18", null)));
        when(allocationRepository.findByInvoiceId("inv-1"))
                .thenReturn(List.of(allocation("inv-1", DAY_ZERO.plusDays(30), "10000.00")));

        ProfitabilityDto profitability = service.getProfitability("inv-1", DAY_ZERO.plusDays(60));

        assertEquals(new BigDecimal("2852.05"), profitability.getFinalGrossProfit());
    }

    @Test
    void getInvoiceBalance_ShouldFailForUnknownInvoice() {
        when(invoiceRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.getInvoiceBalance("missing"));
    }

    @Test
    void getUtilization_ShouldTreatMissingProfileAsNoLimit() {
        when(profileRepository.findById("cust-1")).thenReturn(Optional.empty());
        when(invoiceRepository.findByCustomerId("cust-1")).thenReturn(List.of(invoice("inv-1", DAY_ZERO, "800.00")));
        when(allocationRepository.findByCustomerId("cust-1")).thenReturn(List.of());

        UtilizationDto utilization = service.getUtilization("cust-1");

        assertEquals(new BigDecimal("800.00"), utilization.getUtilizedLimit());
        assertNull(utilization.getUtilizationPct());
        assertEquals(UtilizationBand.NO_LIMIT, utilization.getBand());
    }

    @Test
    void getCustomerInterestSummary_ShouldCombineInvoiceAndOpeningBalanceInterest() {
        when(profileRepository.findById("cust-1")).thenReturn(Optional.of(profile("12", "5000.00")));
        when(allocationRepository.findByCustomerId("cust-1"))
                .thenReturn(List.of(allocation("inv-1", DAY_ZERO.plusDays(30), "10000.00")));
        InvoiceDto invoice = invoice("inv-1", DAY_ZERO, "10000.00").toBuilder()
                .interestRate(new BigDecimal("18"))
                .build();
        when(invoiceRepository.findByCustomerId("cust-1")).thenReturn(List.of(invoice));

        CustomerInterestSummaryDto summary = service.getCustomerInterestSummary("cust-1", DAY_ZERO.plusDays(73));

        assertEquals(new BigDecimal("147.95"), summary.getInvoiceInterest());
        assertEquals(new BigDecimal("120.00"), summary.getOpeningBalanceInterest());
        assertEquals(new BigDecimal("267.95"), summary.getTotalInterest());
    }

    @Test
    void getCreditManagementData_ShouldListProfilesByCustomerId() {
        when(invoiceRepository.findAll()).thenReturn(List.of());
        when(allocationRepository.findAll()).thenReturn(List.of());
        when(profileRepository.findAll()).thenReturn(List.of(
                CustomerCreditProfileDto.builder().customerId("cust-2").creditLimit(new BigDecimal("100.00")).build(),
                CustomerCreditProfileDto.builder().customerId("cust-1").creditLimit(new BigDecimal("100.00")).build()));

        List<UtilizationDto> rows = service.getCreditManagementData();

        assertEquals(2, rows.size());
        assertEquals("cust-1", rows.get(0).getCustomerId());
        assertEquals(UtilizationBand.NOT_UTILIZED, rows.get(0).getBand());
    }

    @Test
    void getInvoiceStatusCards_ShouldGroupByDueAndPaidState() {
        LocalDate asOf = LocalDate.of(2025, 3, 10);
        when(invoiceRepository.findAll()).thenReturn(List.of(
                invoice("upcoming", LocalDate.of(2025, 3, 20), "100.00"),
                invoice("today", LocalDate.of(2025, 3, 10), "200.00"),
                invoice("grace", LocalDate.of(2025, 3, 5), "300.00"),
                invoice("overdue", LocalDate.of(2025, 2, 20), "400.00"),
                invoice("onTime", LocalDate.of(2025, 2, 1), "500.00"),
                invoice("late", LocalDate.of(2025, 1, 1), "600.00"),
                invoice("zero", LocalDate.of(2025, 1, 1), "0.00")));
        when(allocationRepository.findAll()).thenReturn(List.of(
                allocation("overdue", LocalDate.of(2025, 2, 25), "100.00"),
                allocation("onTime", LocalDate.of(2025, 2, 6), "500.00"),
                allocation("late", LocalDate.of(2025, 2, 1), "600.00")));

        InvoiceStatusCardsDto cards = service.getInvoiceStatusCards(asOf);

        assertEquals(7, cards.getGraceDays());
        assertCard(cards.getUpcoming(), 1, "100.00");
        assertCard(cards.getDueToday(), 1, "200.00");
        assertCard(cards.getInGrace(), 1, "300.00");
        assertCard(cards.getOverdue(), 1, "400.00");
        assertCard(cards.getPaidOnTime(), 2, "500.00");
        assertCard(cards.getPaidLate(), 1, "600.00");
    }

    @Test
    void getLedgerStatement_ShouldCarryEarlierEntriesIntoOpeningBalanceAndMarkSides() {
        when(profileRepository.findById("cust-1")).thenReturn(Optional.of(profile("18", "1000.00")));
        when(invoiceRepository.findByCustomerId("cust-1")).thenReturn(List.of(
                invoice("inv-c", LocalDate.of(2025, 4, 1), "500.00"),
                invoice("inv-a", LocalDate.of(2025, 1, 1), "3000.00"),
                invoice("inv-b", LocalDate.of(2025, 2, 10), "2000.00")));
        when(receiptRepository.findByCustomerId("cust-1")).thenReturn(List.of(
                receipt("rcpt-b", "cust-1", LocalDate.of(2025, 2, 10), "1000.00"),
                receipt("rcpt-c", "cust-1", LocalDate.of(2025, 2, 20), "6000.00"),
                receipt("rcpt-a", "cust-1", LocalDate.of(2025, 1, 15), "1500.00")));

        LedgerStatementDto statement = service.getLedgerStatement("cust-1",
                LocalDate.of(2025, 2, 1), LocalDate.of(2025, 3, 31));

        // 1000 opening + 3000 invoiced - 1500 received before February
        assertEquals(new BigDecimal("2500.00"), statement.getOpeningBalance());
        assertEquals(BalanceSide.DR, statement.getOpeningBalanceSide());

        List<LedgerStatementDto.Entry> entries = statement.getEntries();
        assertEquals(List.of("inv-b", "rcpt-b", "rcpt-c"),
                entries.stream().map(LedgerStatementDto.Entry::getReferenceId).toList());
        assertEquals(LedgerEntryType.INVOICE, entries.get(0).getType());
        assertEquals(new BigDecimal("4500.00"), entries.get(0).getBalance());
        assertEquals(new BigDecimal("3500.00"), entries.get(1).getBalance());
        assertEquals(BalanceSide.DR, entries.get(1).getBalanceSide());
        assertEquals(new BigDecimal("2500.00"), entries.get(2).getBalance());
        assertEquals(BalanceSide.CR, entries.get(2).getBalanceSide());

        assertEquals(new BigDecimal("2000.00"), statement.getTotalDebits());
        assertEquals(new BigDecimal("7000.00"), statement.getTotalCredits());
        assertEquals(new BigDecimal("2500.00"), statement.getClosingBalance());
        assertEquals(BalanceSide.CR, statement.getClosingBalanceSide());
    }

    @Test
    void getLedgerStatement_ShouldRejectRangeEndingBeforeItStarts() {
        assertThrows(ValidationException.class, () -> service.getLedgerStatement("cust-1",
                LocalDate.of(2025, 3, 1), LocalDate.of(2025, 2, 1)));
    }

    @Test
    void getDebtorsList_ShouldKeepPositiveBalancesAndTotalByCategory() {
        when(profileRepository.findAll()).thenReturn(List.of(
                categoryProfile("cust-1", "Alpha").toBuilder().customerOpeningBalance(new BigDecimal("1000.00")).build(),
                categoryProfile("cust-2", "Beta"),
                categoryProfile("cust-3", "Alpha")));
        when(invoiceRepository.findAll()).thenReturn(List.of(
                customerInvoice("inv-1", "cust-1", LocalDate.of(2025, 1, 10), "5000.00"),
                customerInvoice("inv-2", "cust-1", LocalDate.of(2025, 3, 1), "2000.00"),
                customerInvoice("inv-3", "cust-2", LocalDate.of(2025, 2, 1), "3000.00"),
                customerInvoice("inv-4", "cust-3", LocalDate.of(2025, 1, 5), "1000.00"),
                customerInvoice("inv-5", "cust-4", LocalDate.of(2025, 2, 2), "800.00").toBuilder()
                        .customerName("Walk-in Traders")
                        .build()));
        when(receiptRepository.findAll()).thenReturn(List.of(
                receipt("rcpt-1", "cust-1", LocalDate.of(2025, 2, 1), "2500.00"),
                receipt("rcpt-2", "cust-1", LocalDate.of(2025, 3, 5), "1000.00"),
                receipt("rcpt-3", "cust-2", LocalDate.of(2025, 2, 20), "3000.00"),
                receipt("rcpt-4", "cust-3", LocalDate.of(2025, 1, 20), "200.00")));

        DebtorsListDto list = service.getDebtorsList();

        assertEquals(List.of("cust-1", "cust-3", "cust-4"),
                list.getDebtors().stream().map(DebtorDto::getCustomerId).toList());

        DebtorDto top = list.getDebtors().get(0);
        assertEquals(new BigDecimal("4500.00"), top.getBalance());
        assertEquals(new BigDecimal("7000.00"), top.getTotalInvoices());
        assertEquals(new BigDecimal("3500.00"), top.getTotalReceipts());
        assertEquals(2, top.getInvoiceCount());
        assertEquals(LocalDate.of(2025, 3, 1), top.getLastInvoiceDate());
        assertEquals(LocalDate.of(2025, 3, 5), top.getLastPaymentDate());

        DebtorDto walkIn = list.getDebtors().get(2);
        assertEquals("Walk-in Traders", walkIn.getCustomerName());
        assertNull(walkIn.getCategory());
        assertNull(walkIn.getLastPaymentDate());

        assertEquals(1, list.getCategories().size());
        DebtorsListDto.CategoryTotal alpha = list.getCategories().get(0);
        assertEquals("Alpha", alpha.getCategory());
        assertEquals(2, alpha.getCount());
        assertEquals(new BigDecimal("5300.00"), alpha.getTotalBalance());
        assertEquals(new BigDecimal("6100.00"), list.getTotalBalance());
    }

    // ==================== HELPER METHODS ====================

    private void assertCard(InvoiceStatusCardsDto.Card card, int count, String amount) {
        assertEquals(count, card.getCount());
        assertEquals(new BigDecimal(amount), card.getTotalAmount());
    }

    private InvoiceDto invoice(String id, LocalDate dueDate, String amount) {
        return InvoiceDto.builder()
                .id(id)
                .invoiceNumber("INV-" + id)
                .customerId("cust-1")
                .invoiceDate(dueDate)
                .paymentTermsDays(0)
                .invoiceAmount(new BigDecimal(amount))
                .build();
    }

    private InvoiceDto customerInvoice(String id, String customerId, LocalDate invoiceDate, String amount) {
        return invoice(id, invoiceDate, amount).toBuilder()
                .customerId(customerId)
                .build();
    }

    private ReceiptDto receipt(String id, String customerId, LocalDate paymentDate, String amount) {
        return ReceiptDto.builder()
                .id(id)
                .voucherNumber("RV-" + id)
                .customerId(customerId)
                .amount(new BigDecimal(amount))
                .paymentDate(paymentDate)
                .build();
    }

    private CustomerCreditProfileDto categoryProfile(String customerId, String category) {
        return CustomerCreditProfileDto.builder()
                .customerId(customerId)
                .category(category)
                .build();
    }

    private AllocationDto allocation(String invoiceId, LocalDate paymentDate, String amount) {
        return AllocationDto.builder()
                .id(AllocationDto.idOf("rcpt-" + invoiceId, invoiceId))
                .receiptId("rcpt-" + invoiceId)
                .invoiceId(invoiceId)
                .customerId("cust-1")
                .paymentDate(paymentDate)
                .allocatedAmount(new BigDecimal(amount))
                .build();
    }

    private CustomerCreditProfileDto profile(String rate, String openingBalance) {
        return CustomerCreditProfileDto.builder()
                .customerId("cust-1")
                .interestRate(new BigDecimal(rate))
                .customerOpeningBalance(openingBalance != null ? new BigDecimal(openingBalance) : null)
                .interestApplicableFrom(DAY_ZERO)
                .build();
    }
}
