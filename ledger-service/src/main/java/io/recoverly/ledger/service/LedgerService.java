package io.recoverly.ledger.service;

import io.recoverly.common.dto.ledger.*;
import io.recoverly.common.dto.score.PaymentScoreDto;
import io.recoverly.common.exception.InvalidAmountException;
import io.recoverly.common.exception.LedgerException;
import io.recoverly.common.exception.ResourceNotFoundException;
import io.recoverly.common.exception.ValidationException;
import io.recoverly.ledger.event.UnallocatedReceiptEvent;
import io.recoverly.ledger.repository.AllocationRepository;
import io.recoverly.ledger.repository.InvoiceRepository;
import io.recoverly.ledger.repository.ReceiptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies receipt and invoice changes to the ledger.
 *
 * Every mutation runs under the customer's lock and ends with the
 * customer's allocations, invoice statuses and payment score consistent
 * with the stored receipts and invoices.
 *
 * Receipts: retract-then-reapply for the single receipt.
 * Invoices: the customer's receipts are replayed from scratch.
 *
 * A failed storage read raises StorageException before anything is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private static final String RECEIPT = "Receipt";
    private static final String INVOICE = "Invoice";
    private static final int MAX_OWNER_LOCK_ATTEMPTS = 5;

    private final InvoiceRepository invoiceRepository;
    private final ReceiptRepository receiptRepository;
    private final AllocationRepository allocationRepository;
    private final PaymentAllocationService paymentAllocationService;
    private final PaymentScoreRecalculationService paymentScoreRecalculationService;
    private final CustomerLockManager lockManager;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ==================== RECEIPTS ====================

    public AllocationResultDto createReceipt(ReceiptDto receipt) {
        validateReceipt(receipt);
        ReceiptDto toSave = receipt.getCreatedAt() != null
                ? receipt
                : receipt.toBuilder().createdAt(LocalDateTime.now(clock)).build();

        log.info("Creating receipt {} for customer {}: {}", toSave.getId(), toSave.getCustomerId(), toSave.getAmount());
        return lockManager.withLock(toSave.getCustomerId(), () -> applyReceipt(toSave));
    }

    /**
     * Edit a receipt. Its previous allocations are retracted before the new
     * state is applied.
     *
     * A receipt moved to another customer is detached under the old
     * customer's lock (allocations retracted, receipt saved with its new
     * customer), then applied under the new customer's lock from its stored
     * state. A delete that lands between the two steps wins.
     */
    public AllocationResultDto updateReceipt(ReceiptDto receipt) {
        validateReceipt(receipt);

        Optional<AllocationResultDto> applied = withOwnerLock(RECEIPT, receipt.getId(),
                receiptRepository::findById, ReceiptDto::getCustomerId, existing -> {
                    ReceiptDto toSave = receipt.toBuilder()
                            .createdAt(existing.getCreatedAt() != null ? existing.getCreatedAt() : receipt.getCreatedAt())
                            .build();

                    if (Objects.equals(existing.getCustomerId(), toSave.getCustomerId())) {
                        log.info("Updating receipt {} for customer {}", toSave.getId(), toSave.getCustomerId());
                        return Optional.of(applyReceipt(toSave));
                    }

                    log.info("Receipt {} moved from customer {} to {}",
                            toSave.getId(), existing.getCustomerId(), toSave.getCustomerId());
                    detachReceipt(existing, toSave);
                    return Optional.empty();
                });

        return applied.orElseGet(() -> withOwnerLock(RECEIPT, receipt.getId(),
                receiptRepository::findById, ReceiptDto::getCustomerId, this::applyReceipt));
    }

    public void deleteReceipt(String receiptId) {
        withOwnerLock(RECEIPT, receiptId, receiptRepository::findById, ReceiptDto::getCustomerId, existing -> {
            log.info("Deleting receipt {} of customer {}", receiptId, existing.getCustomerId());
            retractReceipt(existing);
            return null;
        });
    }

    // ==================== INVOICES ====================

    public LedgerRebuildDto createInvoice(InvoiceDto invoice) {
        validateInvoice(invoice);
        InvoiceDto toSave = invoice.toBuilder()
                .status(null)
                .createdAt(invoice.getCreatedAt() != null ? invoice.getCreatedAt() : LocalDateTime.now(clock))
                .build();

        log.info("Creating invoice {} for customer {}: {}", toSave.getId(), toSave.getCustomerId(), toSave.getInvoiceAmount());
        return lockManager.withLock(toSave.getCustomerId(), () -> {
            invoiceRepository.save(toSave);
            return rebuildAndRescore(toSave.getCustomerId());
        });
    }

    /**
     * Edit an invoice. Amount, due date or customer changes alter what every
     * receipt of the customer saw, so the customer's ledger is replayed.
     */
    public LedgerRebuildDto updateInvoice(InvoiceDto invoice) {
        validateInvoice(invoice);

        Optional<LedgerRebuildDto> rebuilt = withOwnerLock(INVOICE, invoice.getId(),
                invoiceRepository::findById, InvoiceDto::getCustomerId, existing -> {
                    boolean customerChanged = !Objects.equals(existing.getCustomerId(), invoice.getCustomerId());
                    InvoiceDto toSave = invoice.toBuilder()
                            .status(customerChanged ? null : existing.getStatus())
                            .createdAt(existing.getCreatedAt() != null ? existing.getCreatedAt() : invoice.getCreatedAt())
                            .build();

                    log.info("Updating invoice {} for customer {}", toSave.getId(), toSave.getCustomerId());
                    invoiceRepository.save(toSave);
                    LedgerRebuildDto previousOwner = rebuildAndRescore(existing.getCustomerId());

                    if (customerChanged) {
                        log.info("Invoice {} moved from customer {} to {}",
                                toSave.getId(), existing.getCustomerId(), toSave.getCustomerId());
                        return Optional.empty();
                    }
                    return Optional.of(previousOwner);
                });

        return rebuilt.orElseGet(() -> lockManager.withLock(invoice.getCustomerId(),
                () -> rebuildAndRescore(invoice.getCustomerId())));
    }

    public LedgerRebuildDto deleteInvoice(String invoiceId) {
        return withOwnerLock(INVOICE, invoiceId, invoiceRepository::findById, InvoiceDto::getCustomerId, existing -> {
            log.info("Deleting invoice {} of customer {}", invoiceId, existing.getCustomerId());
            invoiceRepository.delete(invoiceId);
            return rebuildAndRescore(existing.getCustomerId());
        });
    }

    // ==================== CUSTOMERS ====================

    /**
     * Replay the customer's ledger and refresh its payment score.
     */
    public PaymentScoreDto recalculateCustomer(String customerId) {
        requireId(customerId, "customerId");
        log.info("Recalculating ledger of customer {}", customerId);
        return lockManager.withLock(customerId, () -> {
            rebuild(customerId);
            return paymentScoreRecalculationService.recalculateCustomer(customerId, today());
        });
    }

    // ==================== HELPER METHODS ====================

    private AllocationResultDto applyReceipt(ReceiptDto receipt) {
        String customerId = receipt.getCustomerId();
        List<InvoiceDto> invoices = invoiceRepository.findByCustomerId(customerId);
        List<AllocationDto> prior = allocationRepository.findByCustomerId(customerId);

        AllocationResultDto result = paymentAllocationService.allocate(receipt, invoices, prior);

        receiptRepository.save(receipt);
        allocationRepository.replaceForReceipt(receipt.getId(), result.getAllocations(),
                changedStatuses(invoices, result.getInvoiceBalances()));

        if (result.getUnallocatedAmount().signum() > 0) {
            publishUnallocated(receipt.getId(), customerId, result.getReceiptAmount(), result.getUnallocatedAmount());
        }

        log.info("Receipt {} applied: {} allocated over {} invoices, {} unallocated",
                receipt.getId(), result.getAllocatedAmount(), result.getAllocations().size(),
                result.getUnallocatedAmount());

        paymentScoreRecalculationService.recalculateCustomer(customerId, today());
        return result;
    }

    /**
     * Run an action on a stored entity under its customer's lock.
     *
     * The entity is read again once the lock is held. If it moved to another
     * customer in the meantime, the lock is released and the new customer's
     * lock is taken instead.
     */
    private <E, T> T withOwnerLock(String resourceType, String id, Function<String, Optional<E>> finder,
                                   Function<E, String> ownerOf, Function<E, T> action) {
        for (int attempt = 1; attempt <= MAX_OWNER_LOCK_ATTEMPTS; attempt++) {
            String customerId = ownerOf.apply(finder.apply(id)
                    .orElseThrow(() -> new ResourceNotFoundException(resourceType, id)));

            OwnerLocked<T> outcome = lockManager.withLock(customerId, () -> {
                E current = finder.apply(id)
                        .orElseThrow(() -> new ResourceNotFoundException(resourceType, id));
                if (!Objects.equals(ownerOf.apply(current), customerId)) {
                    return OwnerLocked.<T>moved();
                }
                return OwnerLocked.of(action.apply(current));
            });

            if (!outcome.isMoved()) {
                return outcome.getValue();
            }
            log.info("{} {} moved away from customer {} while waiting for its lock, retrying",
                    resourceType, id, customerId);
        }
        throw new LedgerException(String.format("%s %s kept moving between customers, giving up after %d attempts",
                resourceType, id, MAX_OWNER_LOCK_ATTEMPTS), "LEDGER_ERR_409");
    }

    /**
     * First step of a receipt move: retract it from the old customer and store it with the new one.
     */
    private void detachReceipt(ReceiptDto existing, ReceiptDto moved) {
        String customerId = existing.getCustomerId();
        List<InvoiceDto> invoices = invoiceRepository.findByCustomerId(customerId);
        List<AllocationDto> retained = paymentAllocationService.retract(existing.getId(),
                allocationRepository.findByCustomerId(customerId));

        List<InvoiceBalanceDto> balances = paymentAllocationService.summarizeBalances(invoices, retained);
        allocationRepository.replaceForReceipt(existing.getId(), List.of(), changedStatuses(invoices, balances));
        receiptRepository.save(moved);

        paymentScoreRecalculationService.recalculateCustomer(customerId, today());
    }

    private void retractReceipt(ReceiptDto receipt) {
        String customerId = receipt.getCustomerId();
        List<InvoiceDto> invoices = invoiceRepository.findByCustomerId(customerId);
        List<AllocationDto> retained = paymentAllocationService.retract(receipt.getId(),
                allocationRepository.findByCustomerId(customerId));

        List<InvoiceBalanceDto> balances = paymentAllocationService.summarizeBalances(invoices, retained);
        allocationRepository.replaceForReceipt(receipt.getId(), List.of(), changedStatuses(invoices, balances));
        receiptRepository.delete(receipt.getId());

        paymentScoreRecalculationService.recalculateCustomer(customerId, today());
    }

    private LedgerRebuildDto rebuildAndRescore(String customerId) {
        LedgerRebuildDto rebuilt = rebuild(customerId);
        paymentScoreRecalculationService.recalculateCustomer(customerId, today());
        return rebuilt;
    }

    private LedgerRebuildDto rebuild(String customerId) {
        List<InvoiceDto> invoices = invoiceRepository.findByCustomerId(customerId);
        List<ReceiptDto> receipts = receiptRepository.findByCustomerId(customerId);

        LedgerRebuildDto rebuilt = paymentAllocationService.rebuild(customerId, receipts, invoices);
        allocationRepository.replaceForCustomer(customerId, rebuilt.getAllocations(),
                changedStatuses(invoices, rebuilt.getInvoiceBalances()));

        Map<String, ReceiptDto> receiptsById = receipts.stream()
                .collect(Collectors.toMap(ReceiptDto::getId, Function.identity(), (a, b) -> a));
        rebuilt.getUnallocatedByReceipt().forEach((receiptId, unallocated) ->
                publishUnallocated(receiptId, customerId,
                        receiptsById.get(receiptId).getAmount(), unallocated));

        return rebuilt;
    }

    /**
     * Balances whose derived status differs from the stored invoice status.
     */
    private List<InvoiceBalanceDto> changedStatuses(List<InvoiceDto> invoices, List<InvoiceBalanceDto> balances) {
        Map<String, InvoiceStatus> stored = invoices.stream()
                .filter(i -> i.getStatus() != null)
                .collect(Collectors.toMap(InvoiceDto::getId, InvoiceDto::getStatus, (a, b) -> a));
        return balances.stream()
                .filter(b -> b.getStatus() != stored.get(b.getInvoiceId()))
                .toList();
    }

    private void publishUnallocated(String receiptId, String customerId, BigDecimal amount, BigDecimal unallocated) {
        eventPublisher.publishEvent(new UnallocatedReceiptEvent(receiptId, customerId, amount, unallocated));
    }

    private void validateReceipt(ReceiptDto receipt) {
        requireId(receipt.getId(), "receipt.id");
        if (receipt.getAmount() == null || receipt.getAmount().signum() <= 0) {
            throw new InvalidAmountException("receipt.amount", receipt.getAmount());
        }
        requireId(receipt.getCustomerId(), "receipt.customerId");
        if (receipt.getPaymentDate() == null) {
            throw new ValidationException("receipt.paymentDate", "Payment date is required");
        }
    }

    private void validateInvoice(InvoiceDto invoice) {
        requireId(invoice.getId(), "invoice.id");
        requireId(invoice.getCustomerId(), "invoice.customerId");
        if (invoice.getInvoiceAmount() == null || invoice.getInvoiceAmount().signum() < 0) {
            throw new InvalidAmountException("invoice.invoiceAmount", invoice.getInvoiceAmount());
        }
        if (invoice.getInvoiceDate() == null && invoice.getDueDateOverride() == null) {
            throw new ValidationException("invoice.invoiceDate", "Invoice date or due date override is required");
        }
    }

    private void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be blank");
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static final class OwnerLocked<T> {
        private final T value;
        private final boolean moved;

        private OwnerLocked(T value, boolean moved) {
            this.value = value;
            this.moved = moved;
        }

        static <T> OwnerLocked<T> of(T value) {
            return new OwnerLocked<>(value, false);
        }

        static <T> OwnerLocked<T> moved() {
            return new OwnerLocked<>(null, true);
        }

        T getValue() {
            return value;
        }

        boolean isMoved() {
            return moved;
        }
    }
}
