package io.recoverly.ledger.event;

import io.recoverly.common.dto.ledger.InvoiceDto;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An invoice was created, edited or deleted upstream.
 *
 * Carries the full invoice state; for DELETED only id and customerId are required.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class InvoiceChangedEvent {

    private final ChangeType changeType;
    private final InvoiceDto invoice;
}
