package io.recoverly.ledger.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Request to recalculate derived ledger state.
 *
 * With a customerId only that customer is rebuilt and rescored; without one
 * a full payment score batch job is queued.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class RecalculationRequestedEvent {

    private final String customerId;
    private final String source;

    public static RecalculationRequestedEvent forCustomer(String customerId) {
        return new RecalculationRequestedEvent(customerId, "event");
    }

    public static RecalculationRequestedEvent global(String source) {
        return new RecalculationRequestedEvent(null, source);
    }

    public boolean isGlobal() {
        return customerId == null;
    }
}
