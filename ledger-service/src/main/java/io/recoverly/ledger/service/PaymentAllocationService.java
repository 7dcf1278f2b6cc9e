package io.recoverly.ledger.service;

import io.recoverly.common.dto.ledger.*;
import io.recoverly.common.exception.CustomerMismatchException;
import io.recoverly.common.exception.InvalidAmountException;
import io.recoverly.common.exception.ResourceNotFoundException;
import io.recoverly.common.exception.ValidationException;
import io.recoverly.common.util.AmountUtils;
import io.recoverly.common.util.DateUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;

import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsLast;

/**
 * Payment allocator - matches receipts against outstanding invoices.
 *
 * Allocation rules:
 * - Explicit invoice reference: the whole receipt goes to that invoice, up to its balance
 * - Otherwise FIFO: due date ascending, then creation order
 * - Anything that does not fit is reported as unallocatedAmount
 *
 * Pure calculation: no repository access. The same inputs always produce
 * the same allocation set.
 */
@Slf4j
@Service
public class PaymentAllocationService {

    /**
     * Waterfall order of invoices.
     */
    static final Comparator<InvoiceDto> FIFO_ORDER = Comparator
            .comparing(PaymentAllocationService::dueDateOf, nullsLast(naturalOrder()))
            .thenComparing(InvoiceDto::getCreatedAt, nullsLast(naturalOrder()))
            .thenComparing(InvoiceDto::getId, nullsLast(naturalOrder()));

    /**
     * Order in which receipts are replayed when a customer's ledger is rebuilt.
     */
    static final Comparator<ReceiptDto> REPLAY_ORDER = Comparator
            .comparing(ReceiptDto::getPaymentDate, nullsLast(naturalOrder()))
            .thenComparing(ReceiptDto::getCreatedAt, nullsLast(naturalOrder()))
            .thenComparing(ReceiptDto::getId, nullsLast(naturalOrder()));

    /**
     * Allocate one receipt.
     *
     * Prior allocations of the receipt itself are retracted first, so the same
     * call serves create and edit.
     *
     * @param receipt           receipt to apply
     * @param candidateInvoices invoices of the receipt's customer
     * @param priorAllocations  existing allocations of the customer
     * @return allocations of this receipt, unallocated remainder and new invoice balances
     */
    public AllocationResultDto allocate(ReceiptDto receipt,
                                        List<InvoiceDto> candidateInvoices,
                                        List<AllocationDto> priorAllocations) {
        validateReceipt(receipt);

        List<AllocationDto> retained = retract(receipt.getId(), priorAllocations);
        Map<String, BigDecimal> allocatedByInvoice = totalsByInvoice(retained);

        List<AllocationDto> allocations = apply(receipt, candidateInvoices, allocatedByInvoice);

        BigDecimal allocated = AmountUtils.sum(allocations.stream()
                .map(AllocationDto::getAllocatedAmount)
                .toList());
        BigDecimal unallocated = AmountUtils.round(receipt.getAmount()).subtract(allocated);

        if (unallocated.signum() > 0) {
            log.warn("Receipt {} of customer {} could not be fully applied: {} unallocated",
                    receipt.getId(), receipt.getCustomerId(), unallocated);
        }

        log.debug("Receipt {} allocated {} across {} invoices",
                receipt.getId(), allocated, allocations.size());

        return AllocationResultDto.builder()
                .receiptId(receipt.getId())
                .customerId(receipt.getCustomerId())
                .receiptAmount(AmountUtils.round(receipt.getAmount()))
                .allocatedAmount(allocated)
                .unallocatedAmount(unallocated)
                .allocations(allocations)
                .invoiceBalances(balancesOf(candidateInvoices, allocatedByInvoice))
                .build();
    }

    /**
     * Drop the allocations of a receipt, restoring the balances it consumed.
     */
    public List<AllocationDto> retract(String receiptId, List<AllocationDto> allocations) {
        if (allocations == null) {
            return List.of();
        }
        return allocations.stream()
                .filter(a -> !Objects.equals(a.getReceiptId(), receiptId))
                .toList();
    }

    /**
     * Replay every receipt of a customer from scratch.
     *
     * Used when an invoice is created, edited or deleted, since that changes
     * the balances every later receipt saw. A receipt whose explicit invoice is
     * gone (or belongs elsewhere) stays fully unallocated instead of failing the
     * whole rebuild.
     */
    public LedgerRebuildDto rebuild(String customerId, List<ReceiptDto> receipts, List<InvoiceDto> invoices) {
        Map<String, BigDecimal> allocatedByInvoice = new HashMap<>();
        List<AllocationDto> allocations = new ArrayList<>();
        Map<String, BigDecimal> unallocatedByReceipt = new LinkedHashMap<>();

        List<ReceiptDto> ordered = receipts.stream().sorted(REPLAY_ORDER).toList();

        for (ReceiptDto receipt : ordered) {
            if (!AmountUtils.isPositive(receipt.getAmount()) || receipt.getPaymentDate() == null) {
                log.warn("Skipping malformed receipt {} during rebuild of customer {}", receipt.getId(), customerId);
                continue;
            }

            List<AllocationDto> applied;
            try {
                applied = apply(receipt, invoices, allocatedByInvoice);
            } catch (ResourceNotFoundException | CustomerMismatchException e) {
                log.warn("Receipt {} left unallocated during rebuild: {}", receipt.getId(), e.getMessage());
                applied = List.of();
            }
            allocations.addAll(applied);

            BigDecimal allocated = AmountUtils.sum(applied.stream().map(AllocationDto::getAllocatedAmount).toList());
            BigDecimal unallocated = AmountUtils.round(receipt.getAmount()).subtract(allocated);
            if (unallocated.signum() > 0) {
                unallocatedByReceipt.put(receipt.getId(), unallocated);
            }
        }

        log.debug("Rebuilt ledger of customer {}: {} receipts, {} allocations",
                customerId, ordered.size(), allocations.size());

        return LedgerRebuildDto.builder()
                .customerId(customerId)
                .allocations(allocations)
                .invoiceBalances(balancesOf(invoices, allocatedByInvoice))
                .unallocatedByReceipt(unallocatedByReceipt)
                .build();
    }

    /**
     * Current balance of one invoice given all allocations (other invoices' rows are ignored).
     */
    public InvoiceBalanceDto summarizeBalance(InvoiceDto invoice, List<AllocationDto> allocations) {
        BigDecimal allocated = AmountUtils.sum(allocations.stream()
                .filter(a -> Objects.equals(a.getInvoiceId(), invoice.getId()))
                .map(AllocationDto::getAllocatedAmount)
                .toList());
        return balanceOf(invoice, allocated);
    }

    /**
     * Balances of several invoices, in FIFO order.
     */
    public List<InvoiceBalanceDto> summarizeBalances(List<InvoiceDto> invoices, List<AllocationDto> allocations) {
        return balancesOf(invoices, totalsByInvoice(allocations));
    }

    /**
     * Status implied by an invoice's remaining balance.
     *
     * remaining <= 0 is PAID (a zero-amount invoice is settled by definition).
     */
    public static InvoiceStatus deriveStatus(BigDecimal invoiceAmount, BigDecimal remaining) {
        if (remaining.signum() <= 0) {
            return InvoiceStatus.PAID;
        }
        if (remaining.compareTo(AmountUtils.nullToZero(invoiceAmount)) >= 0) {
            return InvoiceStatus.UNPAID;
        }
        return InvoiceStatus.PARTIAL;
    }

    /**
     * Effective due date of an invoice.
     */
    public static LocalDate dueDateOf(InvoiceDto invoice) {
        return DateUtils.resolveDueDate(invoice.getInvoiceDate(), invoice.getPaymentTermsDays(),
                invoice.getDueDateOverride());
    }

    // ==================== HELPER METHODS ====================

    private List<AllocationDto> apply(ReceiptDto receipt, List<InvoiceDto> candidates,
                                      Map<String, BigDecimal> allocatedByInvoice) {
        List<InvoiceDto> targets = selectTargets(receipt, candidates);

        List<AllocationDto> allocations = new ArrayList<>();
        BigDecimal remaining = AmountUtils.round(receipt.getAmount());

        for (InvoiceDto invoice : targets) {
            if (remaining.signum() <= 0) {
                break;
            }

            BigDecimal alreadyAllocated = allocatedByInvoice.getOrDefault(invoice.getId(), AmountUtils.zero());
            BigDecimal balance = AmountUtils.nullToZero(invoice.getInvoiceAmount()).subtract(alreadyAllocated);
            if (balance.signum() <= 0) {
                continue;
            }

            BigDecimal portion = AmountUtils.min(balance, remaining);
            allocations.add(AllocationDto.builder()
                    .id(AllocationDto.idOf(receipt.getId(), invoice.getId()))
                    .receiptId(receipt.getId())
                    .invoiceId(invoice.getId())
                    .customerId(receipt.getCustomerId())
                    .paymentDate(receipt.getPaymentDate())
                    .allocatedAmount(portion)
                    .daysOverdueAtPayment(DateUtils.daysOverdue(dueDateOf(invoice), receipt.getPaymentDate()))
                    .build());

            allocatedByInvoice.merge(invoice.getId(), portion, BigDecimal::add);
            remaining = remaining.subtract(portion);
        }

        return allocations;
    }

    private List<InvoiceDto> selectTargets(ReceiptDto receipt, List<InvoiceDto> candidates) {
        if (receipt.getInvoiceId() != null && !receipt.getInvoiceId().isBlank()) {
            InvoiceDto target = candidates.stream()
                    .filter(i -> receipt.getInvoiceId().equals(i.getId()))
                    .findFirst()
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice", receipt.getInvoiceId()));
            checkSameCustomer(receipt, target);
            return List.of(target);
        }

        candidates.forEach(invoice -> checkSameCustomer(receipt, invoice));
        return candidates.stream().sorted(FIFO_ORDER).toList();
    }

    private void checkSameCustomer(ReceiptDto receipt, InvoiceDto invoice) {
        if (!Objects.equals(receipt.getCustomerId(), invoice.getCustomerId())) {
            throw new CustomerMismatchException(receipt.getId(), receipt.getCustomerId(),
                    invoice.getId(), invoice.getCustomerId());
        }
    }

    private void validateReceipt(ReceiptDto receipt) {
        if (receipt == null) {
            throw new ValidationException("receipt", "is required");
        }
        if (!AmountUtils.isPositive(receipt.getAmount())) {
            throw new InvalidAmountException("amount", receipt.getAmount());
        }
        if (receipt.getCustomerId() == null || receipt.getCustomerId().isBlank()) {
            throw new ValidationException("customerId", "is required");
        }
        if (receipt.getPaymentDate() == null) {
            throw new ValidationException("paymentDate", "is required");
        }
    }

    private Map<String, BigDecimal> totalsByInvoice(List<AllocationDto> allocations) {
        Map<String, BigDecimal> totals = new HashMap<>();
        if (allocations == null) {
            return totals;
        }
        for (AllocationDto allocation : allocations) {
            totals.merge(allocation.getInvoiceId(),
                    AmountUtils.nullToZero(allocation.getAllocatedAmount()), BigDecimal::add);
        }
        return totals;
    }

    private List<InvoiceBalanceDto> balancesOf(List<InvoiceDto> invoices, Map<String, BigDecimal> allocatedByInvoice) {
        return invoices.stream()
                .sorted(FIFO_ORDER)
                .map(invoice -> balanceOf(invoice,
                        allocatedByInvoice.getOrDefault(invoice.getId(), AmountUtils.zero())))
                .toList();
    }

    private InvoiceBalanceDto balanceOf(InvoiceDto invoice, BigDecimal allocated) {
        BigDecimal amount = AmountUtils.nullToZero(invoice.getInvoiceAmount());
        BigDecimal remaining = AmountUtils.floorAtZero(amount.subtract(allocated));
        return InvoiceBalanceDto.builder()
                .invoiceId(invoice.getId())
                .customerId(invoice.getCustomerId())
                .invoiceAmount(amount)
                .allocatedAmount(AmountUtils.round(allocated))
                .remainingBalance(remaining)
                .status(deriveStatus(amount, remaining))
                .build();
    }
}
