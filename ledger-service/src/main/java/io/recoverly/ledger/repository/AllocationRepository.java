package io.recoverly.ledger.repository;

import com.google.cloud.firestore.*;
import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.InvoiceBalanceDto;
import io.recoverly.common.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ExecutionException;

import static io.recoverly.ledger.infrastructure.firebase.FirestoreFutures.await;
import static io.recoverly.ledger.infrastructure.firebase.FirestoreValues.*;

/**
 * Repository for allocations stored in Firebase.
 *
 * Data access only - NO business logic here.
 *
 * Collection: allocations
 * Document ID: receiptId:invoiceId
 *
 * Allocations are never updated in place. The replace* methods delete the
 * previous rows, write the new ones and update the affected invoice
 * statuses in a single WriteBatch, so readers never observe a half-applied
 * receipt.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AllocationRepository {

    private static final String COLLECTION = "allocations";

    private final Firestore firestore;

    /**
     * Find all allocations of a customer.
     *
     * @throws StorageException when the read fails
     */
    public List<AllocationDto> findByCustomerId(String customerId) {
        return query(firestore.collection(COLLECTION).whereEqualTo("customerId", customerId),
                "findAllocationsByCustomer", "allocations of customer " + customerId);
    }

    /**
     * Find all allocations applied to an invoice.
     *
     * @throws StorageException when the read fails
     */
    public List<AllocationDto> findByInvoiceId(String invoiceId) {
        return query(firestore.collection(COLLECTION).whereEqualTo("invoiceId", invoiceId),
                "findAllocationsByInvoice", "allocations of invoice " + invoiceId);
    }

    /**
     * Get all allocations. A failed read logs and returns an empty list.
     */
    public List<AllocationDto> findAll() {
        try {
            QuerySnapshot snapshot = firestore.collection(COLLECTION).get().get();
            return snapshot.getDocuments().stream()
                    .map(this::documentToDto)
                    .toList();
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error fetching all allocations: {}", e.getMessage());
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        }
    }

    /**
     * Retract the receipt's allocations and write its new ones, with invoice statuses, atomically.
     */
    public void replaceForReceipt(String receiptId, List<AllocationDto> allocations,
                                  List<InvoiceBalanceDto> balances) {
        try {
            WriteBatch batch = firestore.batch();
            QuerySnapshot existing = firestore.collection(COLLECTION)
                    .whereEqualTo("receiptId", receiptId)
                    .get().get();
            existing.getDocuments().forEach(doc -> batch.delete(doc.getReference()));

            writeAllocations(batch, allocations);
            writeStatuses(batch, balances);
            batch.commit().get();

            log.debug("Replaced {} allocations with {} for receipt {}",
                    existing.size(), allocations.size(), receiptId);
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error replacing allocations for receipt {}: {}", receiptId, e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("replaceForReceipt", "Failed to replace allocations of receipt " + receiptId, e);
        }
    }

    /**
     * Replace every allocation of a customer, with invoice statuses, atomically.
     */
    public void replaceForCustomer(String customerId, List<AllocationDto> allocations,
                                   List<InvoiceBalanceDto> balances) {
        try {
            WriteBatch batch = firestore.batch();
            QuerySnapshot existing = firestore.collection(COLLECTION)
                    .whereEqualTo("customerId", customerId)
                    .get().get();
            existing.getDocuments().forEach(doc -> batch.delete(doc.getReference()));

            writeAllocations(batch, allocations);
            writeStatuses(batch, balances);
            batch.commit().get();

            log.info("Rebuilt allocations for customer {}: {} removed, {} written",
                    customerId, existing.size(), allocations.size());
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error rebuilding allocations for customer {}: {}", customerId, e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("replaceForCustomer", "Failed to rebuild allocations of customer " + customerId, e);
        }
    }

    // ==================== HELPER METHODS ====================

    private List<AllocationDto> query(Query query, String operation, String description) {
        QuerySnapshot snapshot = await(query.get(), operation, description);
        return snapshot.getDocuments().stream()
                .map(this::documentToDto)
                .toList();
    }

    private void writeAllocations(WriteBatch batch, List<AllocationDto> allocations) {
        for (AllocationDto allocation : allocations) {
            DocumentReference ref = firestore.collection(COLLECTION).document(allocation.getId());
            batch.set(ref, dtoToMap(allocation));
        }
    }

    private void writeStatuses(WriteBatch batch, List<InvoiceBalanceDto> balances) {
        for (InvoiceBalanceDto balance : balances) {
            DocumentReference ref = firestore.collection(InvoiceRepository.COLLECTION)
                    .document(balance.getInvoiceId());
            batch.update(ref, "status", balance.getStatus().name());
        }
    }

    private AllocationDto documentToDto(DocumentSnapshot doc) {
        return AllocationDto.builder()
                .id(doc.getId())
                .receiptId(doc.getString("receiptId"))
                .invoiceId(doc.getString("invoiceId"))
                .customerId(doc.getString("customerId"))
                .paymentDate(toDate(doc.get("paymentDate")))
                .allocatedAmount(toAmount(doc.get("allocatedAmount")))
                .daysOverdueAtPayment(toInteger(doc.get("daysOverdueAtPayment")))
                .build();
    }

    private Map<String, Object> dtoToMap(AllocationDto dto) {
        Map<String, Object> data = new HashMap<>();
        data.put("receiptId", dto.getReceiptId());
        data.put("invoiceId", dto.getInvoiceId());
        data.put("customerId", dto.getCustomerId());
        data.put("paymentDate", fromDate(dto.getPaymentDate()));
        data.put("allocatedAmount", fromAmount(dto.getAllocatedAmount()));
        data.put("daysOverdueAtPayment", dto.getDaysOverdueAtPayment());
        return data;
    }
}
