package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.config.AsyncConfig;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Best-effort status log. Runs on the status log executor; failures and rejected writes are logged and
 * never reach the caller.
 */
@Component
public class PaymentStatusLogger {

    private static final Logger log = LoggerFactory.getLogger(PaymentStatusLogger.class);

    private final StatusLogWriter writer;
    private final Executor executor;

    public PaymentStatusLogger(StatusLogWriter writer, @Qualifier(AsyncConfig.STATUS_LOG_EXECUTOR) Executor executor) {
        this.writer = writer;
        this.executor = executor;
    }

    /**
     * Records an observed status.
     *
     * @param providerName provider name
     * @param orderId      merchant order id
     * @param status       observed status
     * @param source       where it was observed
     */
    public void log(String providerName, String orderId, OrderStatus status, StatusSource source) {
        try {
            executor.execute(() -> write(providerName, orderId, status, source));
        } catch (RejectedExecutionException e) {
            log.warn("Status log queue full; entry dropped. provider={} orderId={} status={} source={}",
                    providerName, orderId, status, source);
        }
    }

    private void write(String providerName, String orderId, OrderStatus status, StatusSource source) {
        try {
            writer.write(providerName, orderId, status, source);
        } catch (RuntimeException e) {
            log.warn("Failed to write status log. provider={} orderId={} status={} source={} error={}",
                    providerName, orderId, status, source, e.toString());
        }
    }
}
