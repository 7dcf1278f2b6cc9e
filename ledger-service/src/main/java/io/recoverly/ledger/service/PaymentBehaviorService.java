package io.recoverly.ledger.service;

import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.score.PaymentClassification;
import io.recoverly.common.dto.score.PaymentScoreDto;
import io.recoverly.common.exception.ValidationException;
import io.recoverly.common.util.AmountUtils;
import io.recoverly.common.util.DateUtils;
import io.recoverly.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

/**
 * Payment behavior classifier.
 *
 * Every allocation is one payment against one invoice due date:
 * - on time when daysOverdueAtPayment == 0
 * - onTimeRate = onTime / total x 100
 * - avgDelayDays = mean(daysOverdueAtPayment)
 * - paymentScore = onTimeWeight x onTimeRate + delayWeight x delayScore (weights normalized)
 *   delayScore = 100 - min(100, weightedDelay x penaltyPerDay)
 *   weightedDelay weights each payment by amount and by 0.5^(ageDays / halfLifeDays)
 * - classification follows onTimeRate (STAR >= 80, REGULAR >= 50, RISKY >= 30, else CRITICAL)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentBehaviorService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerProperties ledgerProperties;

    /**
     * Score a customer from its payment history.
     *
     * @param customerId customer
     * @param history    the customer's allocations
     * @param asOf       reference date for recency weighting
     * @throws ValidationException when a payment lacks a date or amount, or has negative delay
     */
    public PaymentScoreDto classify(String customerId, List<AllocationDto> history, LocalDate asOf) {
        history.forEach(this::validatePayment);

        int total = history.size();
        if (total == 0) {
            return PaymentScoreDto.builder()
                    .customerId(customerId)
                    .calculatedAsOf(asOf)
                    .build();
        }

        int onTime = (int) history.stream()
                .filter(a -> a.getDaysOverdueAtPayment() == 0)
                .count();
        long totalDelay = history.stream()
                .mapToLong(AllocationDto::getDaysOverdueAtPayment)
                .sum();

        BigDecimal onTimeRate = BigDecimal.valueOf(onTime)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        BigDecimal avgDelay = BigDecimal.valueOf(totalDelay)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);

        int score = compositeScore(onTimeRate, weightedDelay(history, asOf));
        PaymentClassification classification = PaymentClassification.of(onTimeRate);

        log.debug("Customer {} scored: payments={}, onTime={}, rate={}%, avgDelay={}, score={}, class={}",
                customerId, total, onTime, onTimeRate, avgDelay, score, classification);

        return PaymentScoreDto.builder()
                .customerId(customerId)
                .totalPayments(total)
                .onTimeCount(onTime)
                .lateCount(total - onTime)
                .onTimeRate(onTimeRate)
                .avgDelayDays(avgDelay)
                .paymentScore(score)
                .classification(classification)
                .calculatedAsOf(asOf)
                .build();
    }

    // ==================== HELPER METHODS ====================

    private int compositeScore(BigDecimal onTimeRate, double weightedDelay) {
        LedgerProperties.Scoring scoring = ledgerProperties.getScoring();
        double onTimeWeight = scoring.getOnTimeWeight().doubleValue();
        double delayWeight = scoring.getDelayWeight().doubleValue();
        double weightSum = onTimeWeight + delayWeight;
        if (weightSum <= 0) {
            onTimeWeight = 1;
            delayWeight = 0;
            weightSum = 1;
        }

        double penalty = weightedDelay * scoring.getDelayPenaltyPerDay().doubleValue();
        double delayScore = 100 - Math.min(100, penalty);

        double composite = (onTimeWeight * onTimeRate.doubleValue() + delayWeight * delayScore) / weightSum;
        long rounded = Math.round(composite);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    /**
     * Amount- and recency-weighted mean delay in days.
     */
    private double weightedDelay(List<AllocationDto> history, LocalDate asOf) {
        int halfLife = ledgerProperties.getScoring().getRecencyHalfLifeDays();
        double weightedDays = 0;
        double weights = 0;

        for (AllocationDto payment : history) {
            long age = asOf != null ? Math.max(0, DateUtils.daysBetween(payment.getPaymentDate(), asOf)) : 0;
            double recency = StrictMath.pow(0.5, (double) age / halfLife);
            double weight = payment.getAllocatedAmount().doubleValue() * recency;
            weightedDays += weight * payment.getDaysOverdueAtPayment();
            weights += weight;
        }
        return weights > 0 ? weightedDays / weights : 0;
    }

    private void validatePayment(AllocationDto payment) {
        if (payment.getPaymentDate() == null) {
            throw new ValidationException("paymentDate", "Payment " + payment.getId() + " has no payment date");
        }
        if (!AmountUtils.isPositive(payment.getAllocatedAmount())) {
            throw new ValidationException("allocatedAmount",
                    "Payment " + payment.getId() + " has no positive amount");
        }
        Integer days = payment.getDaysOverdueAtPayment();
        if (days == null || days < 0) {
            throw new ValidationException("daysOverdueAtPayment",
                    "Payment " + payment.getId() + " has invalid delay: " + days);
        }
    }
}
