package com.github.dimitryivaniuta.gateway.smartpay.service.events;

import java.time.Instant;

/**
 * Published to Kafka for every status written to the status log.
 */
public record PaymentStatusObservedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String providerName,
        String orderId,
        String status,
        int statusCode,
        String source
) {}
