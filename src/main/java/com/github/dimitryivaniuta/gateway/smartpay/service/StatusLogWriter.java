package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.smartpay.domain.PaymentStatusLogEntry;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import com.github.dimitryivaniuta.gateway.smartpay.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.smartpay.repo.PaymentStatusLogRepository;
import com.github.dimitryivaniuta.gateway.smartpay.service.events.PaymentStatusObservedEvent;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a status log entry and its outbox event in one transaction.
 *
 * <p>Separate bean from {@link PaymentStatusLogger} so the {@code @Transactional} proxy is not bypassed
 * by self-invocation.</p>
 */
@Service
public class StatusLogWriter {

    static final String EVENT_TYPE = "PaymentStatusObserved";
    static final String SCHEMA_VERSION = "1";

    private final PaymentStatusLogRepository logRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public StatusLogWriter(
            PaymentStatusLogRepository logRepository,
            OutboxEventRepository outboxEventRepository,
            ObjectMapper objectMapper
    ) {
        this.logRepository = logRepository;
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Appends the entry and queues its event.
     *
     * @param providerName provider name
     * @param orderId      merchant order id
     * @param status       observed status
     * @param source       where it was observed
     * @return stored entry
     */
    @Transactional
    public PaymentStatusLogEntry write(String providerName, String orderId, OrderStatus status, StatusSource source) {
        PaymentStatusLogEntry entry = logRepository.save(PaymentStatusLogEntry.of(providerName, orderId, status, source));

        PaymentStatusObservedEvent event = new PaymentStatusObservedEvent(
                SCHEMA_VERSION,
                entry.getId(),
                entry.getCreatedAt(),
                providerName,
                orderId,
                status.name(),
                status.getCode(),
                source.name()
        );
        outboxEventRepository.save(OutboxEvent.pending(entry.getId(), EVENT_TYPE, orderId, toJson(event)));
        return entry;
    }

    private String toJson(PaymentStatusObservedEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize status event", e);
        }
    }
}
