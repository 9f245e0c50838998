package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.smartpay.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes queued status events to Kafka.
 *
 * <p>Batches are locked with {@code FOR UPDATE SKIP LOCKED}, so several instances can run side by side.
 * An event is SENT only after Kafka acknowledged it; failures back off exponentially with jitter and end
 * as DEAD after {@code app.outbox.max-attempts}.</p>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;

        this.sentCounter = Counter.builder("smartpay.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("smartpay.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("smartpay.outbox.dead").register(meterRegistry);
    }

    /**
     * Publishes the next due batch.
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public void publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();

        List<OutboxEvent> batch = outboxEventRepository.lockDueBatch(
                OutboxStatus.DUE,
                Instant.now(),
                outbox.getBatchSize()
        );
        if (batch.isEmpty()) {
            return;
        }

        int sent = 0;
        int retry = 0;
        int dead = 0;

        for (OutboxEvent event : batch) {
            try {
                kafkaTemplate.send(outbox.getStatusEventsTopic(), event.getEventKey(), event.getPayload())
                        .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
                event.markSent();
                sent++;
                sentCounter.increment();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                event.markRetry(safeError(e), outbox.getBaseBackoff());
                retry++;
                retryCounter.increment();
                outboxEventRepository.save(event);
                break;
            } catch (Exception e) {
                String error = safeError(e);
                int attempt = event.getAttemptCount() + 1;
                if (attempt >= outbox.getMaxAttempts()) {
                    event.markDead(error);
                    dead++;
                    deadCounter.increment();
                    log.error("Status event {} moved to DEAD after {} attempts. orderId={} error={}",
                            event.getId(), event.getAttemptCount(), event.getEventKey(), error);
                } else {
                    event.markRetry(error, computeBackoff(outbox.getBaseBackoff(), outbox.getMaxBackoff(), attempt));
                    retry++;
                    retryCounter.increment();
                    log.warn("Status event {} failed. attempt={} nextAttemptAt={} error={}",
                            event.getId(), event.getAttemptCount(), event.getNextAttemptAt(), error);
                }
            }
            outboxEventRepository.save(event);
        }

        log.info("Status event batch done. sent={} retry={} dead={} topic={}", sent, retry, dead, outbox.getStatusEventsTopic());
    }

    /**
     * {@code base * 2^(attempt-1)}, capped at {@code max}, jittered by a factor in [0.5, 1.5) and never below {@code base}.
     */
    static Duration computeBackoff(Duration base, Duration max, int attempt) {
        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long capped = Math.min((long) (base.toMillis() * exp), max.toMillis());
        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long jittered = (long) (capped * jitter);
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(jittered, max.toMillis())));
    }

    private static String safeError(Exception e) {
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }
}
