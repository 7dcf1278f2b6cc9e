package io.recoverly.ledger.service;

import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.dto.credit.UtilizationDto;
import io.recoverly.common.dto.interest.CustomerInterestSummaryDto;
import io.recoverly.common.dto.interest.InterestBreakdownDto;
import io.recoverly.common.dto.ledger.*;
import io.recoverly.common.dto.profit.ProfitabilityDto;
import io.recoverly.common.exception.ResourceNotFoundException;
import io.recoverly.common.exception.ValidationException;
import io.recoverly.common.util.AmountUtils;
import io.recoverly.ledger.config.LedgerProperties;
import io.recoverly.ledger.repository.AllocationRepository;
import io.recoverly.ledger.repository.CustomerCreditProfileRepository;
import io.recoverly.ledger.repository.InvoiceRepository;
import io.recoverly.ledger.repository.ReceiptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read views over the ledger.
 *
 * Interest, profitability and utilization are never stored: every call
 * recomputes them from the current invoices, allocations and profiles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final InvoiceRepository invoiceRepository;
    private final ReceiptRepository receiptRepository;
    private final AllocationRepository allocationRepository;
    private final CustomerCreditProfileRepository profileRepository;
    private final PaymentAllocationService paymentAllocationService;
    private final InterestCalculationService interestCalculationService;
    private final ProfitabilityService profitabilityService;
    private final CreditUtilizationService creditUtilizationService;
    private final LedgerProperties ledgerProperties;

    // ==================== INVOICE VIEWS ====================

    public InterestBreakdownDto getInterestBreakdown(String invoiceId, LocalDate asOf) {
        InvoiceDto invoice = findInvoice(invoiceId);
        BigDecimal customerRate = profileRepository.findById(invoice.getCustomerId())
                .map(CustomerCreditProfileDto::getInterestRate)
                .orElse(null);
        return interestCalculationService.computeInterest(invoice,
                allocationRepository.findByInvoiceId(invoiceId), customerRate, asOf);
    }

    public ProfitabilityDto getProfitability(String invoiceId, LocalDate asOf) {
        InvoiceDto invoice = findInvoice(invoiceId);
        return profitabilityService.resolveProfitability(invoice, getInterestBreakdown(invoiceId, asOf));
    }

    public InvoiceBalanceDto getInvoiceBalance(String invoiceId) {
        InvoiceDto invoice = findInvoice(invoiceId);
        return paymentAllocationService.summarizeBalance(invoice, allocationRepository.findByInvoiceId(invoiceId));
    }

    // ==================== CUSTOMER VIEWS ====================

    public UtilizationDto getUtilization(String customerId) {
        CustomerCreditProfileDto profile = profileOrDefault(customerId);
        return creditUtilizationService.computeUtilization(profile,
                invoiceRepository.findByCustomerId(customerId),
                allocationRepository.findByCustomerId(customerId));
    }

    /**
     * Invoice interest of every invoice of the customer plus opening-balance interest.
     */
    public CustomerInterestSummaryDto getCustomerInterestSummary(String customerId, LocalDate asOf) {
        CustomerCreditProfileDto profile = profileOrDefault(customerId);
        List<AllocationDto> allocations = allocationRepository.findByCustomerId(customerId);

        List<InterestBreakdownDto> breakdowns = invoiceRepository.findByCustomerId(customerId).stream()
                .sorted(PaymentAllocationService.FIFO_ORDER)
                .map(invoice -> interestCalculationService.computeInterest(invoice, allocations,
                        profile.getInterestRate(), asOf))
                .toList();

        return interestCalculationService.summarizeCustomerInterest(profile, breakdowns, asOf);
    }

    /**
     * Utilization row for every customer with a credit profile, by customerId.
     */
    public List<UtilizationDto> getCreditManagementData() {
        Map<String, List<InvoiceDto>> invoicesByCustomer = invoiceRepository.findAll().stream()
                .filter(i -> i.getCustomerId() != null)
                .collect(Collectors.groupingBy(InvoiceDto::getCustomerId));
        Map<String, List<AllocationDto>> allocationsByCustomer = allocationRepository.findAll().stream()
                .filter(a -> a.getCustomerId() != null)
                .collect(Collectors.groupingBy(AllocationDto::getCustomerId));

        List<UtilizationDto> rows = profileRepository.findAll().stream()
                .sorted(Comparator.comparing(CustomerCreditProfileDto::getCustomerId))
                .map(profile -> creditUtilizationService.computeUtilization(profile,
                        invoicesByCustomer.getOrDefault(profile.getCustomerId(), List.of()),
                        allocationsByCustomer.getOrDefault(profile.getCustomerId(), List.of())))
                .toList();

        log.debug("Credit management data: {} customers", rows.size());
        return rows;
    }

    // ==================== STATEMENTS ====================

    /**
     * Ledger statement of a customer: invoices debit, receipts credit, with a
     * running balance. Either bound may be null for an open range.
     *
     * Same-day entries list invoices before receipts, then by creation time.
     */
    public LedgerStatementDto getLedgerStatement(String customerId, LocalDate fromDate, LocalDate toDate) {
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new ValidationException("fromDate", "From date " + fromDate + " is after to date " + toDate);
        }
        CustomerCreditProfileDto profile = profileOrDefault(customerId);
        List<InvoiceDto> invoices = invoiceRepository.findByCustomerId(customerId);
        List<ReceiptDto> receipts = receiptRepository.findByCustomerId(customerId);

        List<StatementLine> lines = new ArrayList<>();
        invoices.stream()
                .filter(i -> i.getInvoiceDate() != null)
                .map(StatementLine::ofInvoice)
                .forEach(lines::add);
        receipts.stream()
                .filter(r -> r.getPaymentDate() != null)
                .map(StatementLine::ofReceipt)
                .forEach(lines::add);
        lines.sort(StatementLine.ORDER);

        BigDecimal opening = CreditUtilizationService.applicableOpeningBalance(profile);
        BigDecimal running = opening;
        BigDecimal totalDebits = AmountUtils.zero();
        BigDecimal totalCredits = AmountUtils.zero();
        List<LedgerStatementDto.Entry> entries = new ArrayList<>();

        for (StatementLine line : lines) {
            if (fromDate != null && line.date().isBefore(fromDate)) {
                opening = opening.add(line.debit()).subtract(line.credit());
                running = opening;
                continue;
            }
            if (toDate != null && line.date().isAfter(toDate)) {
                break;
            }
            running = running.add(line.debit()).subtract(line.credit());
            totalDebits = totalDebits.add(line.debit());
            totalCredits = totalCredits.add(line.credit());
            entries.add(LedgerStatementDto.Entry.builder()
                    .date(line.date())
                    .type(line.type())
                    .referenceId(line.referenceId())
                    .voucherNumber(line.voucherNumber())
                    .debit(line.debit())
                    .credit(line.credit())
                    .balance(running.abs())
                    .balanceSide(BalanceSide.of(running))
                    .build());
        }

        log.debug("Ledger statement for {} from {} to {}: {} entries, closing {}",
                customerId, fromDate, toDate, entries.size(), running);

        return LedgerStatementDto.builder()
                .customerId(customerId)
                .customerName(customerName(profile, invoices, receipts))
                .fromDate(fromDate)
                .toDate(toDate)
                .openingBalance(opening.abs())
                .openingBalanceSide(BalanceSide.of(opening))
                .entries(entries)
                .totalDebits(totalDebits)
                .totalCredits(totalCredits)
                .closingBalance(running.abs())
                .closingBalanceSide(BalanceSide.of(running))
                .build();
    }

    /**
     * Every customer whose opening balance plus invoices less receipts is
     * positive. Customers are those with a profile, an invoice or a receipt.
     */
    public DebtorsListDto getDebtorsList() {
        Map<String, CustomerCreditProfileDto> profiles = profileRepository.findAll().stream()
                .filter(p -> p.getCustomerId() != null)
                .collect(Collectors.toMap(CustomerCreditProfileDto::getCustomerId, Function.identity(), (a, b) -> a));
        Map<String, List<InvoiceDto>> invoicesByCustomer = invoiceRepository.findAll().stream()
                .filter(i -> i.getCustomerId() != null)
                .collect(Collectors.groupingBy(InvoiceDto::getCustomerId));
        Map<String, List<ReceiptDto>> receiptsByCustomer = receiptRepository.findAll().stream()
                .filter(r -> r.getCustomerId() != null)
                .collect(Collectors.groupingBy(ReceiptDto::getCustomerId));

        Set<String> customerIds = new LinkedHashSet<>(profiles.keySet());
        customerIds.addAll(invoicesByCustomer.keySet());
        customerIds.addAll(receiptsByCustomer.keySet());

        List<DebtorDto> debtors = new ArrayList<>();
        for (String customerId : customerIds) {
            CustomerCreditProfileDto profile = profiles.getOrDefault(customerId,
                    CustomerCreditProfileDto.builder().customerId(customerId).build());
            List<InvoiceDto> invoices = invoicesByCustomer.getOrDefault(customerId, List.of());
            List<ReceiptDto> receipts = receiptsByCustomer.getOrDefault(customerId, List.of());

            BigDecimal opening = CreditUtilizationService.applicableOpeningBalance(profile);
            BigDecimal totalInvoices = AmountUtils.sum(invoices.stream().map(InvoiceDto::getInvoiceAmount).toList());
            BigDecimal totalReceipts = AmountUtils.sum(receipts.stream().map(ReceiptDto::getAmount).toList());
            BigDecimal balance = opening.add(totalInvoices).subtract(totalReceipts);
            if (balance.signum() <= 0) {
                continue;
            }

            debtors.add(DebtorDto.builder()
                    .customerId(customerId)
                    .customerName(customerName(profile, invoices, receipts))
                    .category(profile.getCategory())
                    .openingBalance(opening)
                    .totalInvoices(totalInvoices)
                    .totalReceipts(totalReceipts)
                    .balance(balance)
                    .invoiceCount(invoices.size())
                    .receiptCount(receipts.size())
                    .lastInvoiceDate(latest(invoices, InvoiceDto::getInvoiceDate))
                    .lastPaymentDate(latest(receipts, ReceiptDto::getPaymentDate))
                    .build());
        }
        debtors.sort(Comparator.comparing(DebtorDto::getBalance).reversed()
                .thenComparing(DebtorDto::getCustomerId));

        Map<String, DebtorsListDto.CategoryTotal> categories = new TreeMap<>();
        for (DebtorDto debtor : debtors) {
            if (debtor.getCategory() == null) {
                continue;
            }
            DebtorsListDto.CategoryTotal total = categories.computeIfAbsent(debtor.getCategory(),
                    category -> DebtorsListDto.CategoryTotal.builder()
                            .category(category)
                            .count(0)
                            .totalBalance(AmountUtils.zero())
                            .build());
            total.setCount(total.getCount() + 1);
            total.setTotalBalance(total.getTotalBalance().add(debtor.getBalance()));
        }

        log.debug("Debtors list: {} debtors in {} categories", debtors.size(), categories.size());

        return DebtorsListDto.builder()
                .debtors(debtors)
                .categories(new ArrayList<>(categories.values()))
                .totalBalance(AmountUtils.sum(debtors.stream().map(DebtorDto::getBalance).toList()))
                .build();
    }

    // ==================== DASHBOARD ====================

    /**
     * Invoices grouped by due and paid state as of a date.
     *
     * Outstanding invoices: upcoming (due after asOf), due today, in grace
     * (due date passed, within grace days) or overdue. Paid invoices: on time
     * when the last payment falls within due date + grace days, else late.
     * Card amounts are invoice amounts.
     */
    public InvoiceStatusCardsDto getInvoiceStatusCards(LocalDate asOf) {
        int graceDays = ledgerProperties.getGraceDays();
        Map<String, List<AllocationDto>> allocationsByInvoice = allocationRepository.findAll().stream()
                .filter(a -> a.getInvoiceId() != null)
                .collect(Collectors.groupingBy(AllocationDto::getInvoiceId));

        InvoiceStatusCardsDto cards = InvoiceStatusCardsDto.builder()
                .upcoming(emptyCard())
                .dueToday(emptyCard())
                .inGrace(emptyCard())
                .overdue(emptyCard())
                .paidOnTime(emptyCard())
                .paidLate(emptyCard())
                .graceDays(graceDays)
                .build();

        for (InvoiceDto invoice : invoiceRepository.findAll()) {
            LocalDate dueDate = PaymentAllocationService.dueDateOf(invoice);
            if (dueDate == null) {
                log.warn("Invoice {} has no due date, left out of status cards", invoice.getId());
                continue;
            }
            LocalDate graceEnd = dueDate.plusDays(graceDays);
            List<AllocationDto> allocations = allocationsByInvoice.getOrDefault(invoice.getId(), List.of());
            InvoiceBalanceDto balance = paymentAllocationService.summarizeBalance(invoice, allocations);
            BigDecimal amount = AmountUtils.nullToZero(invoice.getInvoiceAmount());

            if (balance.getStatus() == InvoiceStatus.PAID) {
                LocalDate lastPayment = allocations.stream()
                        .map(AllocationDto::getPaymentDate)
                        .filter(Objects::nonNull)
                        .max(Comparator.naturalOrder())
                        .orElse(null);
                add(lastPayment == null || !lastPayment.isAfter(graceEnd) ? cards.getPaidOnTime() : cards.getPaidLate(),
                        amount);
            } else if (dueDate.isEqual(asOf)) {
                add(cards.getDueToday(), amount);
            } else if (dueDate.isAfter(asOf)) {
                add(cards.getUpcoming(), amount);
            } else if (!asOf.isAfter(graceEnd)) {
                add(cards.getInGrace(), amount);
            } else {
                add(cards.getOverdue(), amount);
            }
        }

        return cards;
    }

    // ==================== HELPER METHODS ====================

    private InvoiceDto findInvoice(String invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    /**
     * Customers without a profile have no limit, no opening balance and no customer rate.
     */
    private CustomerCreditProfileDto profileOrDefault(String customerId) {
        return profileRepository.findById(customerId)
                .orElseGet(() -> CustomerCreditProfileDto.builder().customerId(customerId).build());
    }

    private String customerName(CustomerCreditProfileDto profile, List<InvoiceDto> invoices, List<ReceiptDto> receipts) {
        if (profile.getCustomerName() != null) {
            return profile.getCustomerName();
        }
        return invoices.stream().map(InvoiceDto::getCustomerName).filter(Objects::nonNull).findFirst()
                .or(() -> receipts.stream().map(ReceiptDto::getCustomerName).filter(Objects::nonNull).findFirst())
                .orElse(null);
    }

    private <T> LocalDate latest(List<T> items, Function<T, LocalDate> dateOf) {
        return items.stream()
                .map(dateOf)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    private InvoiceStatusCardsDto.Card emptyCard() {
        return InvoiceStatusCardsDto.Card.builder()
                .count(0)
                .totalAmount(AmountUtils.zero())
                .build();
    }

    private void add(InvoiceStatusCardsDto.Card card, BigDecimal amount) {
        card.setCount(card.getCount() + 1);
        card.setTotalAmount(card.getTotalAmount().add(amount));
    }

    private record StatementLine(LocalDate date, LedgerEntryType type, String referenceId, String voucherNumber,
                                 BigDecimal debit, BigDecimal credit, LocalDateTime createdAt) {

        static final Comparator<StatementLine> ORDER = Comparator.comparing(StatementLine::date)
                .thenComparing(StatementLine::type)
                .thenComparing(StatementLine::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(StatementLine::referenceId, Comparator.nullsLast(Comparator.naturalOrder()));

        static StatementLine ofInvoice(InvoiceDto invoice) {
            return new StatementLine(invoice.getInvoiceDate(), LedgerEntryType.INVOICE, invoice.getId(),
                    invoice.getInvoiceNumber(), AmountUtils.nullToZero(invoice.getInvoiceAmount()), AmountUtils.zero(),
                    invoice.getCreatedAt());
        }

        static StatementLine ofReceipt(ReceiptDto receipt) {
            return new StatementLine(receipt.getPaymentDate(), LedgerEntryType.RECEIPT, receipt.getId(),
                    receipt.getVoucherNumber(), AmountUtils.zero(), AmountUtils.nullToZero(receipt.getAmount()),
                    receipt.getCreatedAt());
        }
    }
}
