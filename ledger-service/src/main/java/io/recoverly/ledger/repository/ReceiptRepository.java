package io.recoverly.ledger.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import io.recoverly.common.dto.ledger.ReceiptDto;
import io.recoverly.common.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ExecutionException;

import static io.recoverly.ledger.infrastructure.firebase.FirestoreFutures.await;
import static io.recoverly.ledger.infrastructure.firebase.FirestoreValues.*;

/**
 * Repository for receipts (incoming payments) stored in Firebase.
 *
 * Data access only - NO business logic here.
 *
 * Collection: receipts
 * Document ID: receipt id
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ReceiptRepository {

    private static final String COLLECTION = "receipts";

    private final Firestore firestore;

    /**
     * Find receipt by ID.
     *
     * @throws StorageException when the read fails
     */
    public Optional<ReceiptDto> findById(String id) {
        DocumentSnapshot doc = await(firestore.collection(COLLECTION).document(id).get(),
                "findReceipt", "receipt " + id);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(documentToDto(doc));
    }

    /**
     * Find all receipts of a customer.
     *
     * @throws StorageException when the read fails
     */
    public List<ReceiptDto> findByCustomerId(String customerId) {
        QuerySnapshot snapshot = await(firestore.collection(COLLECTION)
                        .whereEqualTo("customerId", customerId)
                        .get(),
                "findReceiptsByCustomer", "receipts of customer " + customerId);
        return snapshot.getDocuments().stream()
                .map(this::documentToDto)
                .toList();
    }

    /**
     * Get all receipts. A failed read logs and returns an empty list.
     */
    public List<ReceiptDto> findAll() {
        try {
            QuerySnapshot snapshot = firestore.collection(COLLECTION).get().get();
            return snapshot.getDocuments().stream()
                    .map(this::documentToDto)
                    .toList();
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error fetching all receipts: {}", e.getMessage());
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        }
    }

    /**
     * Save or replace a receipt.
     */
    public ReceiptDto save(ReceiptDto receipt) {
        try {
            firestore.collection(COLLECTION)
                    .document(receipt.getId())
                    .set(dtoToMap(receipt))
                    .get();
            log.debug("Saved receipt: {}", receipt.getId());
            return receipt;
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error saving receipt {}: {}", receipt.getId(), e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("saveReceipt", "Failed to save receipt " + receipt.getId(), e);
        }
    }

    /**
     * Delete a receipt.
     */
    public void delete(String id) {
        try {
            firestore.collection(COLLECTION).document(id).delete().get();
            log.debug("Deleted receipt: {}", id);
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error deleting receipt {}: {}", id, e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("deleteReceipt", "Failed to delete receipt " + id, e);
        }
    }

    // ==================== HELPER METHODS ====================

    private ReceiptDto documentToDto(DocumentSnapshot doc) {
        return ReceiptDto.builder()
                .id(doc.getId())
                .voucherNumber(doc.getString("voucherNumber"))
                .customerId(doc.getString("customerId"))
                .customerName(doc.getString("customerName"))
                .amount(toAmount(doc.get("amount")))
                .paymentDate(toDate(doc.get("paymentDate")))
                .invoiceId(doc.getString("invoiceId"))
                .createdAt(toDateTime(doc.get("createdAt")))
                .build();
    }

    private Map<String, Object> dtoToMap(ReceiptDto dto) {
        Map<String, Object> data = new HashMap<>();
        data.put("voucherNumber", dto.getVoucherNumber());
        data.put("customerId", dto.getCustomerId());
        data.put("customerName", dto.getCustomerName());
        data.put("amount", fromAmount(dto.getAmount()));
        data.put("paymentDate", fromDate(dto.getPaymentDate()));
        data.put("invoiceId", dto.getInvoiceId());
        data.put("createdAt", fromDateTime(dto.getCreatedAt()));
        return data;
    }
}
