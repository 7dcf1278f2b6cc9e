package io.recoverly.ledger.event;

import io.recoverly.common.dto.ledger.ReceiptDto;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A receipt (payment) was created, edited or deleted upstream.
 *
 * Carries the full receipt state; for DELETED only id is required.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ReceiptChangedEvent {

    private final ChangeType changeType;
    private final ReceiptDto receipt;
}
