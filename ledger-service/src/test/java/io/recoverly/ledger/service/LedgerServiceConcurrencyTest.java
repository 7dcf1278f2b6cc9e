package io.recoverly.ledger.service;

import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.ledger.ReceiptDto;
import io.recoverly.ledger.repository.AllocationRepository;
import io.recoverly.ledger.repository.InvoiceRepository;
import io.recoverly.ledger.repository.ReceiptRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Receipt mutations running on several threads against the real per-customer lock.
 */
@ExtendWith(MockitoExtension.class)
class LedgerServiceConcurrencyTest {

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private ReceiptRepository receiptRepository;

    @Mock
    private AllocationRepository allocationRepository;

    @Mock
    private PaymentScoreRecalculationService paymentScoreRecalculationService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private final ExecutorService pool = Executors.newFixedThreadPool(3);

    private LedgerService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        service = new LedgerService(invoiceRepository, receiptRepository, allocationRepository,
                new PaymentAllocationService(), paymentScoreRecalculationService,
                new CustomerLockManager(), eventPublisher, clock);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void createReceipt_ShouldSerializeSameCustomerAndLeaveOthersUnblocked() throws Exception {
        CountDownLatch firstInside = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        CountDownLatch secondInside = new CountDownLatch(1);
        AtomicInteger sameCustomerReads = new AtomicInteger();

        when(invoiceRepository.findByCustomerId("cust-1")).thenAnswer(invocation -> {
            events.add("read:cust-1");
            if (sameCustomerReads.incrementAndGet() == 1) {
                firstInside.countDown();
                assertTrue(releaseFirst.await(5, TimeUnit.SECONDS));
            } else {
                secondInside.countDown();
            }
            return List.of(invoice("inv-1", "cust-1"));
        });
        when(invoiceRepository.findByCustomerId("cust-2")).thenAnswer(invocation -> {
            events.add("read:cust-2");
            return List.of(invoice("inv-2", "cust-2"));
        });
        when(allocationRepository.findByCustomerId(anyString())).thenReturn(List.of());
        doAnswer(invocation -> {
            events.add("commit:" + invocation.getArgument(0));
            return null;
        }).when(allocationRepository).replaceForReceipt(anyString(), anyList(), anyList());

        Future<?> first = pool.submit(() -> service.createReceipt(receipt("rcpt-1", "cust-1")));
        assertTrue(firstInside.await(5, TimeUnit.SECONDS));

        Future<?> second = pool.submit(() -> service.createReceipt(receipt("rcpt-2", "cust-1")));
        Future<?> otherCustomer = pool.submit(() -> service.createReceipt(receipt("rcpt-3", "cust-2")));

        otherCustomer.get(5, TimeUnit.SECONDS);
        assertTrue(events.contains("commit:rcpt-3"));
        assertFalse(events.contains("commit:rcpt-1"));
        assertFalse(secondInside.await(200, TimeUnit.MILLISECONDS));

        releaseFirst.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        List<String> sameCustomer = new ArrayList<>(events);
        sameCustomer.removeIf(event -> event.endsWith("cust-2") || event.endsWith("rcpt-3"));
        assertEquals(List.of("read:cust-1", "commit:rcpt-1", "read:cust-1", "commit:rcpt-2"), sameCustomer);
    }

    // ==================== HELPER METHODS ====================

    private InvoiceDto invoice(String id, String customerId) {
        return InvoiceDto.builder()
                .id(id)
                .invoiceNumber("INV-" + id)
                .customerId(customerId)
                .invoiceDate(LocalDate.of(2025, 1, 1))
                .paymentTermsDays(30)
                .invoiceAmount(new BigDecimal("10000.00"))
                .build();
    }

    private ReceiptDto receipt(String id, String customerId) {
        return ReceiptDto.builder()
                .id(id)
                .customerId(customerId)
                .amount(new BigDecimal("500.00"))
                .paymentDate(LocalDate.of(2025, 2, 1))
                .build();
    }
}
