package io.recoverly.ledger.service;

import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.recalculation.RecalculationResultDto;
import io.recoverly.common.dto.score.PaymentScoreDto;
import io.recoverly.ledger.repository.AllocationRepository;
import io.recoverly.ledger.repository.CustomerCreditProfileRepository;
import io.recoverly.ledger.repository.InvoiceRepository;
import io.recoverly.ledger.repository.PaymentScoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;

/**
 * Payment score recalculation, per customer and as a batch over every customer.
 *
 * A score record is written only when its calculated fields change, so
 * running the batch twice over the same ledger leaves the same records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentScoreRecalculationService {

    private final AllocationRepository allocationRepository;
    private final InvoiceRepository invoiceRepository;
    private final CustomerCreditProfileRepository profileRepository;
    private final PaymentScoreRepository paymentScoreRepository;
    private final PaymentBehaviorService paymentBehaviorService;
    private final CustomerLockManager lockManager;
    private final Clock clock;

    /**
     * Rescore one customer under its lock.
     *
     * @return the customer's current score record
     */
    public PaymentScoreDto recalculateCustomer(String customerId, LocalDate asOf) {
        return lockManager.withLock(customerId, () -> refresh(customerId, asOf).getScore());
    }

    /**
     * Rescore every customer once, in ascending customerId order.
     *
     * @param asOf                  reference date of the scores
     * @param resumeAfterCustomerId skip customers up to and including this id (null = start)
     * @param cancelled             checked before each customer; when true the run stops INTERRUPTED
     */
    public RecalculationResultDto recalculateAll(LocalDate asOf, String resumeAfterCustomerId,
                                                 BooleanSupplier cancelled) {
        long startTime = System.currentTimeMillis();

        List<String> customerIds = customerIds().stream()
                .filter(id -> resumeAfterCustomerId == null || id.compareTo(resumeAfterCustomerId) > 0)
                .toList();

        log.info("Recalculating payment scores for {} customers as of {} (resume after: {})",
                customerIds.size(), asOf, resumeAfterCustomerId);

        int processed = 0;
        int updated = 0;
        int unchanged = 0;
        List<String> skipped = new ArrayList<>();
        String lastProcessed = resumeAfterCustomerId;
        RecalculationResultDto.Status status = RecalculationResultDto.Status.COMPLETED;

        for (String customerId : customerIds) {
            if (cancelled.getAsBoolean()) {
                status = RecalculationResultDto.Status.INTERRUPTED;
                log.warn("Recalculation interrupted after {} customers, last processed: {}",
                        processed, lastProcessed);
                break;
            }

            try {
                ScoreRefresh refresh = lockManager.withLock(customerId, () -> refresh(customerId, asOf));
                if (refresh.isChanged()) {
                    updated++;
                } else {
                    unchanged++;
                }
            } catch (RuntimeException e) {
                log.warn("Skipping customer {} in score recalculation: {}", customerId, e.getMessage());
                skipped.add(customerId);
            }

            processed++;
            lastProcessed = customerId;
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Payment score recalculation {}: processed={}, updated={}, unchanged={}, skipped={}, duration={}ms",
                status, processed, updated, unchanged, skipped.size(), duration);

        return RecalculationResultDto.builder()
                .status(status)
                .processed(processed)
                .totalCustomers(customerIds.size())
                .updatedCount(updated)
                .unchangedCount(unchanged)
                .skippedCustomers(skipped)
                .lastProcessedCustomerId(lastProcessed)
                .durationMs(duration)
                .build();
    }

    // ==================== HELPER METHODS ====================

    private ScoreRefresh refresh(String customerId, LocalDate asOf) {
        List<AllocationDto> history = allocationRepository.findByCustomerId(customerId);
        PaymentScoreDto calculated = paymentBehaviorService.classify(customerId, history, asOf);

        Optional<PaymentScoreDto> existing = paymentScoreRepository.findById(customerId);
        if (existing.isPresent() && existing.get().sameScoreAs(calculated)) {
            log.debug("Payment score of customer {} unchanged", customerId);
            return new ScoreRefresh(existing.get(), false);
        }

        PaymentScoreDto saved = paymentScoreRepository.save(calculated.toBuilder()
                .lastCalculatedAt(LocalDateTime.now(clock))
                .build());
        log.debug("Payment score of customer {} updated: score={}, class={}",
                customerId, saved.getPaymentScore(), saved.getClassification());
        return new ScoreRefresh(saved, true);
    }

    /**
     * Every customer known to the ledger: credit profiles, invoices and allocations.
     */
    private TreeSet<String> customerIds() {
        TreeSet<String> ids = new TreeSet<>();
        profileRepository.findAll().stream()
                .map(CustomerCreditProfileDto::getCustomerId)
                .filter(Objects::nonNull)
                .forEach(ids::add);
        invoiceRepository.findAll().stream()
                .map(InvoiceDto::getCustomerId)
                .filter(Objects::nonNull)
                .forEach(ids::add);
        allocationRepository.findAll().stream()
                .map(AllocationDto::getCustomerId)
                .filter(Objects::nonNull)
                .forEach(ids::add);
        return ids;
    }

    private static final class ScoreRefresh {
        private final PaymentScoreDto score;
        private final boolean changed;

        private ScoreRefresh(PaymentScoreDto score, boolean changed) {
            this.score = score;
            this.changed = changed;
        }

        PaymentScoreDto getScore() {
            return score;
        }

        boolean isChanged() {
            return changed;
        }
    }
}
