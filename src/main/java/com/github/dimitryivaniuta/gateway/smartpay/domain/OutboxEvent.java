package com.github.dimitryivaniuta.gateway.smartpay.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Status event written in the same transaction as its {@link PaymentStatusLogEntry} and published to Kafka
 * later by the outbox dispatcher.
 */
@Entity
@Table(
        name = "status_outbox_events",
        indexes = @Index(name = "idx_status_outbox_due", columnList = "status,next_attempt_at,created_at")
)
@Getter
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "log_entry_id", nullable = false, updatable = false, length = 36)
    private String logEntryId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    /**
     * Kafka record key: the merchant order id.
     */
    @Column(name = "event_key", nullable = false, updatable = false, length = 128)
    private String eventKey;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    /**
     * Creates a pending event.
     *
     * @param logEntryId status log entry the event describes
     * @param eventType  event type
     * @param eventKey   Kafka key
     * @param payload    JSON payload
     * @return event in status NEW
     */
    public static OutboxEvent pending(String logEntryId, String eventType, String eventKey, String payload) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.logEntryId = logEntryId;
        e.eventType = eventType;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.createdAt = Instant.now();
        e.updatedAt = e.createdAt;
        return e;
    }

    public void markSent() {
        Instant now = Instant.now();
        status = OutboxStatus.SENT;
        sentAt = now;
        updatedAt = now;
        nextAttemptAt = null;
        lastError = null;
    }

    /**
     * Schedules another attempt.
     *
     * @param error   failure description
     * @param backoff delay before the next attempt
     */
    public void markRetry(String error, Duration backoff) {
        Instant now = Instant.now();
        status = OutboxStatus.RETRY;
        attemptCount++;
        lastError = error;
        nextAttemptAt = now.plus(backoff);
        updatedAt = now;
    }

    public void markDead(String error) {
        status = OutboxStatus.DEAD;
        attemptCount++;
        lastError = error;
        nextAttemptAt = null;
        updatedAt = Instant.now();
    }
}
