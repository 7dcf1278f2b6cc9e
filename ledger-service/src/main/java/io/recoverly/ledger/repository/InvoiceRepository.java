package io.recoverly.ledger.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.ledger.InvoiceStatus;
import io.recoverly.common.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ExecutionException;

import static io.recoverly.ledger.infrastructure.firebase.FirestoreFutures.await;
import static io.recoverly.ledger.infrastructure.firebase.FirestoreValues.*;

/**
 * Repository for invoices stored in Firebase.
 *
 * Data access only - NO business logic here.
 *
 * Collection: invoices
 * Document ID: invoice id
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InvoiceRepository {

    static final String COLLECTION = "invoices";

    private final Firestore firestore;

    /**
     * Find invoice by ID.
     *
     * @throws StorageException when the read fails
     */
    public Optional<InvoiceDto> findById(String id) {
        DocumentSnapshot doc = await(firestore.collection(COLLECTION).document(id).get(),
                "findInvoice", "invoice " + id);
        if (!doc.exists()) {
            return Optional.empty();
        }
        return Optional.of(documentToDto(doc));
    }

    /**
     * Find all invoices of a customer.
     *
     * @throws StorageException when the read fails
     */
    public List<InvoiceDto> findByCustomerId(String customerId) {
        QuerySnapshot snapshot = await(firestore.collection(COLLECTION)
                        .whereEqualTo("customerId", customerId)
                        .get(),
                "findInvoicesByCustomer", "invoices of customer " + customerId);
        return snapshot.getDocuments().stream()
                .map(this::documentToDto)
                .toList();
    }

    /**
     * Get all invoices. A failed read logs and returns an empty list.
     */
    public List<InvoiceDto> findAll() {
        try {
            QuerySnapshot snapshot = firestore.collection(COLLECTION).get().get();
            return snapshot.getDocuments().stream()
                    .map(this::documentToDto)
                    .toList();
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error fetching all invoices: {}", e.getMessage());
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        }
    }

    /**
     * Save or replace an invoice. Status is written by the allocation batch, not here.
     */
    public InvoiceDto save(InvoiceDto invoice) {
        try {
            firestore.collection(COLLECTION)
                    .document(invoice.getId())
                    .set(dtoToMap(invoice))
                    .get();
            log.debug("Saved invoice: {}", invoice.getId());
            return invoice;
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error saving invoice {}: {}", invoice.getId(), e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("saveInvoice", "Failed to save invoice " + invoice.getId(), e);
        }
    }

    /**
     * Delete an invoice.
     */
    public void delete(String id) {
        try {
            firestore.collection(COLLECTION).document(id).delete().get();
            log.debug("Deleted invoice: {}", id);
        } catch (InterruptedException | ExecutionException e) {
            log.error("Error deleting invoice {}: {}", id, e.getMessage());
            Thread.currentThread().interrupt();
            throw new StorageException("deleteInvoice", "Failed to delete invoice " + id, e);
        }
    }

    // ==================== HELPER METHODS ====================

    private InvoiceDto documentToDto(DocumentSnapshot doc) {
        return InvoiceDto.builder()
                .id(doc.getId())
                .invoiceNumber(doc.getString("invoiceNumber"))
                .customerId(doc.getString("customerId"))
                .customerName(doc.getString("customerName"))
                .invoiceDate(toDate(doc.get("invoiceDate")))
                .paymentTermsDays(toInteger(doc.get("paymentTermsDays")))
                .dueDateOverride(toDate(doc.get("dueDateOverride")))
                .invoiceAmount(toAmount(doc.get("invoiceAmount")))
                .costBasis(toAmount(doc.get("costBasis")))
                .interestRate(toAmount(doc.get("interestRate")))
                .status(toEnum(InvoiceStatus.class, doc.get("status")))
                .createdAt(toDateTime(doc.get("createdAt")))
                .build();
    }

    private Map<String, Object> dtoToMap(InvoiceDto dto) {
        Map<String, Object> data = new HashMap<>();
        data.put("invoiceNumber", dto.getInvoiceNumber());
        data.put("customerId", dto.getCustomerId());
        data.put("customerName", dto.getCustomerName());
        data.put("invoiceDate", fromDate(dto.getInvoiceDate()));
        data.put("paymentTermsDays", dto.getPaymentTermsDays());
        data.put("dueDateOverride", fromDate(dto.getDueDateOverride()));
        data.put("invoiceAmount", fromAmount(dto.getInvoiceAmount()));
        data.put("costBasis", fromAmount(dto.getCostBasis()));
        data.put("interestRate", fromAmount(dto.getInterestRate()));
        data.put("status", dto.getStatus() != null ? dto.getStatus().name() : InvoiceStatus.UNPAID.name());
        data.put("createdAt", fromDateTime(dto.getCreatedAt()));
        return data;
    }
}
