package io.recoverly.ledger.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import io.recoverly.common.dto.score.PaymentClassification;
import io.recoverly.common.dto.score.PaymentScoreDto;
import io.recoverly.common.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.ExecutionException;

import static io.recoverly.ledger.infrastructure.firebase.FirestoreFutures.await;
import static io.recoverly.ledger.infrastructure.firebase.FirestoreValues.*;

/**
 * Repository for payment score records stored in Firebase.
 *
 * Collection: payment_scores
 * Document ID: customerId
 *
 * Each record is written with a single document set, so a reader sees
 * either the previous or the new record, never a mix.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PaymentScoreRepository {

    private static final String COLLECTION = "payment_scores";

    private final Firestore firestore;

    /**
     * Get score record of a customer.
     *
     * @throws StorageException when the read fails
     */
    public Optional<PaymentScoreDto> findById(String customerId) {
        DocumentSnapshot doc = await(firestore.collection(COLLECTION).document(customerId).get(),
                "findPaymentScore", "payment score of customer " + customerId);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(documentToDto(doc));
    }

    /**
     * Get all score records. A failed read logs and returns an empty list.
     */
    public List<PaymentScoreDto> findAll() {
        try {
            QuerySnapshot snapshot = firestore.collection(COLLECTION).get().get();
            return snapshot.getDocuments().stream()
                    .map(this::documentToDto)
                    .toList();
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error fetching all payment scores: {}", e.getMessage());
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        }
    }

    /**
     * Replace the score record of a customer.
     */
    public PaymentScoreDto save(PaymentScoreDto score) {
        try {
            firestore.collection(COLLECTION)
                    .document(score.getCustomerId())
                    .set(dtoToMap(score))
                    .get();
            log.debug("Saved payment score for customer: {}", score.getCustomerId());
            return score;
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error saving payment score for customer {}: {}", score.getCustomerId(), e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("savePaymentScore", "Failed to save payment score", e);
        }
    }

    // ==================== HELPER METHODS ====================

    private PaymentScoreDto documentToDto(DocumentSnapshot doc) {
        return PaymentScoreDto.builder()
                .customerId(doc.getId())
                .totalPayments(intOrZero(doc.get("totalPayments")))
                .onTimeCount(intOrZero(doc.get("onTimeCount")))
                .lateCount(intOrZero(doc.get("lateCount")))
                .onTimeRate(toAmount(doc.get("onTimeRate")))
                .avgDelayDays(toAmount(doc.get("avgDelayDays")))
                .paymentScore(toInteger(doc.get("paymentScore")))
                .classification(toEnum(PaymentClassification.class, doc.get("classification")))
                .calculatedAsOf(toDate(doc.get("calculatedAsOf")))
                .lastCalculatedAt(toDateTime(doc.get("lastCalculatedAt")))
                .build();
    }

    private Map<String, Object> dtoToMap(PaymentScoreDto dto) {
        Map<String, Object> data = new HashMap<>();
        data.put("totalPayments", dto.getTotalPayments());
        data.put("onTimeCount", dto.getOnTimeCount());
        data.put("lateCount", dto.getLateCount());
        data.put("onTimeRate", plain(dto.getOnTimeRate()));
        data.put("avgDelayDays", plain(dto.getAvgDelayDays()));
        data.put("paymentScore", dto.getPaymentScore());
        data.put("classification", dto.getClassification() != null ? dto.getClassification().name() : null);
        data.put("calculatedAsOf", fromDate(dto.getCalculatedAsOf()));
        data.put("lastCalculatedAt", fromDateTime(dto.getLastCalculatedAt()));
        return data;
    }

    private String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    private int intOrZero(Object value) {
        Integer i = toInteger(value);
        return i != null ? i : 0;
    }
}
