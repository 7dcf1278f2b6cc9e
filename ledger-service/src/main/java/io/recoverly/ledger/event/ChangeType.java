package io.recoverly.ledger.event;

/**
 * Kind of change carried by an inbound ledger event.
 */
public enum ChangeType {
    CREATED,
    UPDATED,
    DELETED
}
