package com.github.dimitryivaniuta.gateway.smartpay.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only record of a status observed for a merchant order. Rows are never updated.
 */
@Entity
@Table(
        name = "payment_status_log",
        indexes = @Index(name = "idx_status_log_order", columnList = "order_id,created_at")
)
@Getter
@NoArgsConstructor
public class PaymentStatusLogEntry {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "provider_name", nullable = false, updatable = false, length = 64)
    private String providerName;

    @Column(name = "order_id", nullable = false, updatable = false, length = 128)
    private String orderId;

    @Column(name = "status_code", nullable = false, updatable = false)
    private int statusCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 32)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 32)
    private StatusSource source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Factory method.
     *
     * @param providerName provider name
     * @param orderId      merchant order id (invoice number)
     * @param status       observed status
     * @param source       where it was observed
     * @return entry
     */
    public static PaymentStatusLogEntry of(String providerName, String orderId, OrderStatus status, StatusSource source) {
        PaymentStatusLogEntry e = new PaymentStatusLogEntry();
        e.id = UUID.randomUUID().toString();
        e.providerName = providerName;
        e.orderId = orderId;
        e.statusCode = status.getCode();
        e.status = status;
        e.source = source;
        e.createdAt = Instant.now();
        return e;
    }
}
