package io.recoverly.ledger.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Published when a receipt could not be fully applied to invoices.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class UnallocatedReceiptEvent {

    private final String receiptId;
    private final String customerId;
    private final BigDecimal receiptAmount;
    private final BigDecimal unallocatedAmount;
}
