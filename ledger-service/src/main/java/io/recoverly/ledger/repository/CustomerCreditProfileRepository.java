package io.recoverly.ledger.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ExecutionException;

import static io.recoverly.ledger.infrastructure.firebase.FirestoreFutures.await;
import static io.recoverly.ledger.infrastructure.firebase.FirestoreValues.*;

/**
 * Repository for customer credit profiles stored in Firebase.
 *
 * Data access only - NO business logic here.
 *
 * Collection: customer_credit_profiles
 * Document ID: customerId
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CustomerCreditProfileRepository {

    private static final String COLLECTION = "customer_credit_profiles";

    private final Firestore firestore;

    /**
     * Get credit profile of a customer.
     *
     * @throws StorageException when the read fails
     */
    public Optional<CustomerCreditProfileDto> findById(String customerId) {
        DocumentSnapshot doc = await(firestore.collection(COLLECTION).document(customerId).get(),
                "findCreditProfile", "credit profile of customer " + customerId);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(documentToDto(doc));
    }

    /**
     * Get all credit profiles. A failed read logs and returns an empty list.
     */
    public List<CustomerCreditProfileDto> findAll() {
        try {
            QuerySnapshot snapshot = firestore.collection(COLLECTION).get().get();
            return snapshot.getDocuments().stream()
                    .map(this::documentToDto)
                    .toList();
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error fetching all credit profiles: {}", e.getMessage());
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        }
    }

    /**
     * Save or update a credit profile.
     */
    public CustomerCreditProfileDto save(CustomerCreditProfileDto profile) {
        try {
            firestore.collection(COLLECTION)
                    .document(profile.getCustomerId())
                    .set(dtoToMap(profile))
                    .get();
            log.debug("Saved credit profile for customer: {}", profile.getCustomerId());
            return profile;
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error saving credit profile for customer {}: {}", profile.getCustomerId(), e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("saveCreditProfile", "Failed to save credit profile", e);
        }
    }

    // ==================== HELPER METHODS ====================

    private CustomerCreditProfileDto documentToDto(DocumentSnapshot doc) {
        return CustomerCreditProfileDto.builder()
                .customerId(doc.getId())
                .customerName(doc.getString("customerName"))
                .category(doc.getString("category"))
                .creditLimit(toAmount(doc.get("creditLimit")))
                .categoryOpeningBalance(toAmount(doc.get("categoryOpeningBalance")))
                .customerOpeningBalance(toAmount(doc.get("customerOpeningBalance")))
                .interestRate(toAmount(doc.get("interestRate")))
                .interestApplicableFrom(toDate(doc.get("interestApplicableFrom")))
                .build();
    }

    private Map<String, Object> dtoToMap(CustomerCreditProfileDto dto) {
        Map<String, Object> data = new HashMap<>();
        data.put("customerName", dto.getCustomerName());
        data.put("category", dto.getCategory());
        data.put("creditLimit", fromAmount(dto.getCreditLimit()));
        data.put("categoryOpeningBalance", fromAmount(dto.getCategoryOpeningBalance()));
        data.put("customerOpeningBalance", fromAmount(dto.getCustomerOpeningBalance()));
        data.put("interestRate", fromAmount(dto.getInterestRate()));
        data.put("interestApplicableFrom", fromDate(dto.getInterestApplicableFrom()));
        return data;
    }
}
