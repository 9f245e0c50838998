package com.github.dimitryivaniuta.gateway.smartpay.domain;

import java.util.List;

/**
 * Delivery status of a status event waiting in the outbox.
 */
public enum OutboxStatus {
    /** Written with the status log entry, not yet attempted. */
    NEW,
    /** Publishing failed; picked up again after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by Kafka. */
    SENT,
    /** Gave up after the configured number of attempts. */
    DEAD;

    /**
     * Statuses the dispatcher picks up, as stored in the {@code status} column.
     */
    public static final List<String> DUE = List.of(NEW.name(), RETRY.name());
}
