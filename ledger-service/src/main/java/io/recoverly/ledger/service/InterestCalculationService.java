package io.recoverly.ledger.service;

import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.dto.interest.CustomerInterestSummaryDto;
import io.recoverly.common.dto.interest.InterestBreakdownDto;
import io.recoverly.common.dto.interest.InterestCombinationPolicy;
import io.recoverly.common.dto.interest.TrancheInterestDto;
import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.util.AmountUtils;
import io.recoverly.common.util.DateUtils;
import io.recoverly.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsLast;

/**
 * Interest accrual on overdue invoice balances.
 *
 * Business Logic:
 * - Each allocation (tranche) accrues simple interest on its own amount
 * - daysOverdue = max(0, paymentDate - dueDate)
 * - interest = allocatedAmount x annualRate / daysInYear x daysOverdue, rounded to 2 decimals
 * - Rate: invoice rate, falling back to the customer rate
 *
 * Interest is never stored. Every figure here is a pure function of the
 * invoice, its allocations, the rate and the as-of date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterestCalculationService {

    static final String NO_PAYMENTS_MESSAGE = "Interest will be calculated when payments are received";

    private static final Comparator<AllocationDto> TRANCHE_ORDER = Comparator
            .comparing(AllocationDto::getPaymentDate, nullsLast(naturalOrder()))
            .thenComparing(AllocationDto::getReceiptId, nullsLast(naturalOrder()));

    private final LedgerProperties ledgerProperties;

    /**
     * Interest on settled tranches using the invoice's own rate.
     */
    public InterestBreakdownDto computeInterest(InvoiceDto invoice, List<AllocationDto> allocations) {
        return computeInterest(invoice, allocations, null, null);
    }

    /**
     * Interest on settled tranches.
     *
     * @param invoice      invoice
     * @param allocations  allocations (rows of other invoices are ignored)
     * @param customerRate customer annual rate, used when the invoice has none
     */
    public InterestBreakdownDto computeInterest(InvoiceDto invoice, List<AllocationDto> allocations,
                                                BigDecimal customerRate) {
        return computeInterest(invoice, allocations, customerRate, null);
    }

    /**
     * Interest on settled tranches plus a projection on the unpaid balance up to asOf.
     *
     * @param asOf date the unpaid balance is accrued to; null skips the projection
     */
    public InterestBreakdownDto computeInterest(InvoiceDto invoice, List<AllocationDto> allocations,
                                                BigDecimal customerRate, LocalDate asOf) {
        BigDecimal rate = effectiveRate(invoice.getInterestRate(), customerRate);
        LocalDate dueDate = PaymentAllocationService.dueDateOf(invoice);

        List<AllocationDto> invoiceAllocations = allocations == null ? List.of() : allocations.stream()
                .filter(a -> Objects.equals(a.getInvoiceId(), invoice.getId()))
                .sorted(TRANCHE_ORDER)
                .toList();

        List<TrancheInterestDto> tranches = invoiceAllocations.stream()
                .map(a -> toTranche(a, dueDate, rate))
                .toList();

        BigDecimal totalInterest = AmountUtils.sum(tranches.stream()
                .map(TrancheInterestDto::getInterestAmount)
                .toList());
        BigDecimal paid = AmountUtils.sum(invoiceAllocations.stream()
                .map(AllocationDto::getAllocatedAmount)
                .toList());
        BigDecimal unpaid = AmountUtils.floorAtZero(AmountUtils.nullToZero(invoice.getInvoiceAmount()).subtract(paid));

        InterestBreakdownDto.InterestBreakdownDtoBuilder builder = InterestBreakdownDto.builder()
                .invoiceId(invoice.getId())
                .invoiceNumber(invoice.getInvoiceNumber())
                .dueDate(dueDate)
                .invoiceAmount(AmountUtils.nullToZero(invoice.getInvoiceAmount()))
                .annualRate(rate)
                .tranches(tranches)
                .totalInterest(totalInterest)
                .paidAmount(paid)
                .unpaidAmount(unpaid)
                .message(tranches.isEmpty() ? NO_PAYMENTS_MESSAGE : null);

        if (asOf != null) {
            int unpaidDays = unpaid.signum() > 0 ? DateUtils.daysOverdue(dueDate, asOf) : 0;
            BigDecimal unpaidInterest = trancheInterest(unpaid, rate, unpaidDays);
            builder.asOf(asOf)
                    .unpaidDaysOverdue(unpaidDays)
                    .unpaidInterest(unpaidInterest)
                    .totalWithUnpaid(totalInterest.add(unpaidInterest));
        }

        InterestBreakdownDto breakdown = builder.build();
        log.debug("Invoice {} interest: {} tranches, total {}", invoice.getId(), tranches.size(), totalInterest);
        return breakdown;
    }

    /**
     * Interest on one tranche. Non-decreasing in days for a fixed amount and rate.
     */
    public BigDecimal trancheInterest(BigDecimal amount, BigDecimal annualRate, long daysOverdue) {
        return AmountUtils.simpleInterest(amount, annualRate, daysOverdue,
                ledgerProperties.getInterest().getDaysInYear());
    }

    /**
     * Interest on the customer's opening balance from interestApplicableFrom up to asOf.
     *
     * Zero when the customer has no rate, no anchor date or no opening balance.
     */
    public BigDecimal computeOpeningBalanceInterest(CustomerCreditProfileDto profile, LocalDate asOf) {
        BigDecimal openingBalance = CreditUtilizationService.applicableOpeningBalance(profile);
        return openingBalanceInterest(profile, openingBalance, asOf);
    }

    /**
     * Customer-level interest: every invoice breakdown plus the opening-balance term, counted once.
     *
     * SUM adds the two. COMPOUND accrues the opening-balance term on the
     * opening balance plus accumulated invoice interest.
     */
    public CustomerInterestSummaryDto summarizeCustomerInterest(CustomerCreditProfileDto profile,
                                                                List<InterestBreakdownDto> breakdowns,
                                                                LocalDate asOf) {
        InterestCombinationPolicy policy = ledgerProperties.getInterest().getCombinationPolicy();

        BigDecimal invoiceInterest = AmountUtils.sum(breakdowns.stream()
                .map(InterestBreakdownDto::getTotalInterest)
                .toList());

        BigDecimal openingBase = CreditUtilizationService.applicableOpeningBalance(profile);
        if (policy == InterestCombinationPolicy.COMPOUND && openingBase.signum() > 0) {
            openingBase = openingBase.add(invoiceInterest);
        }
        BigDecimal openingInterest = openingBalanceInterest(profile, openingBase, asOf);

        return CustomerInterestSummaryDto.builder()
                .customerId(profile.getCustomerId())
                .asOf(asOf)
                .invoiceCount(breakdowns.size())
                .invoiceInterest(invoiceInterest)
                .openingBalanceInterest(openingInterest)
                .totalInterest(invoiceInterest.add(openingInterest))
                .policy(policy)
                .build();
    }

    // ==================== HELPER METHODS ====================

    private BigDecimal openingBalanceInterest(CustomerCreditProfileDto profile, BigDecimal base, LocalDate asOf) {
        if (profile == null || asOf == null || profile.getInterestApplicableFrom() == null) {
            return AmountUtils.zero();
        }
        if (base == null || base.signum() <= 0) {
            return AmountUtils.zero();
        }
        int days = DateUtils.daysOverdue(profile.getInterestApplicableFrom(), asOf);
        return trancheInterest(base, effectiveRate(null, profile.getInterestRate()), days);
    }

    private TrancheInterestDto toTranche(AllocationDto allocation, LocalDate dueDate, BigDecimal rate) {
        int days = DateUtils.daysOverdue(dueDate, allocation.getPaymentDate());
        return TrancheInterestDto.builder()
                .receiptId(allocation.getReceiptId())
                .paymentDate(allocation.getPaymentDate())
                .allocatedAmount(AmountUtils.nullToZero(allocation.getAllocatedAmount()))
                .daysOverdue(days)
                .interestAmount(trancheInterest(allocation.getAllocatedAmount(), rate, days))
                .build();
    }

    private BigDecimal effectiveRate(BigDecimal invoiceRate, BigDecimal customerRate) {
        if (AmountUtils.isPositive(invoiceRate)) {
            return invoiceRate;
        }
        if (AmountUtils.isPositive(customerRate)) {
            return customerRate;
        }
        return BigDecimal.ZERO;
    }
}
