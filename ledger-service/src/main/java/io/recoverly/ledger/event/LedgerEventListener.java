package io.recoverly.ledger.event;

import io.recoverly.ledger.service.AsyncRecalculationService;
import io.recoverly.ledger.service.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Entry point of inbound ledger changes.
 *
 * Events are handled synchronously on the publisher's thread, so allocation
 * and validation errors reach the publisher.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerEventListener {

    private final LedgerService ledgerService;
    private final AsyncRecalculationService asyncRecalculationService;
    private final Clock clock;

    @EventListener
    public void onInvoiceChanged(InvoiceChangedEvent event) {
        log.debug("Invoice event: {} {}", event.getChangeType(), event.getInvoice().getId());
        switch (event.getChangeType()) {
            case CREATED -> ledgerService.createInvoice(event.getInvoice());
            case UPDATED -> ledgerService.updateInvoice(event.getInvoice());
            case DELETED -> ledgerService.deleteInvoice(event.getInvoice().getId());
        }
    }

    @EventListener
    public void onReceiptChanged(ReceiptChangedEvent event) {
        log.debug("Receipt event: {} {}", event.getChangeType(), event.getReceipt().getId());
        switch (event.getChangeType()) {
            case CREATED -> ledgerService.createReceipt(event.getReceipt());
            case UPDATED -> ledgerService.updateReceipt(event.getReceipt());
            case DELETED -> ledgerService.deleteReceipt(event.getReceipt().getId());
        }
    }

    @EventListener
    public void onRecalculationRequested(RecalculationRequestedEvent event) {
        if (event.isGlobal()) {
            String jobId = asyncRecalculationService.triggerRecalculation(
                    event.getSource(), LocalDate.now(clock), null);
            log.info("Global recalculation requested by {}: job {}", event.getSource(), jobId);
        } else {
            ledgerService.recalculateCustomer(event.getCustomerId());
        }
    }

    @EventListener
    public void onUnallocatedReceipt(UnallocatedReceiptEvent event) {
        log.warn("Receipt {} of customer {} has {} of {} unallocated",
                event.getReceiptId(), event.getCustomerId(),
                event.getUnallocatedAmount(), event.getReceiptAmount());
    }
}
