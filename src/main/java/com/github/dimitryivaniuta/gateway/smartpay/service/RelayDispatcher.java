package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.config.AsyncConfig;
import com.github.dimitryivaniuta.gateway.smartpay.config.RestClientConfig;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SignatureService;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.RelayCall;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ReturnParameters;
import com.github.dimitryivaniuta.gateway.smartpay.web.CorrelationIdFilter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Forwards verified PSP statuses to the store callback.
 *
 * <p>Calls run on the bounded relay executor. Each {@link RelayBatch} tracks its own calls so a notification
 * can wait for them and report what happened.</p>
 */
@Component
public class RelayDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RelayDispatcher.class);

    private final RestClient restClient;
    private final Executor executor;
    private final SignatureService signatureService;
    private final AppProperties props;

    private final Counter relayedCounter;
    private final Counter failedCounter;

    public RelayDispatcher(
            @Qualifier(RestClientConfig.RELAY_REST_CLIENT) RestClient restClient,
            @Qualifier(AsyncConfig.RELAY_EXECUTOR) Executor executor,
            SignatureService signatureService,
            AppProperties props,
            MeterRegistry meterRegistry
    ) {
        this.restClient = restClient;
        this.executor = executor;
        this.signatureService = signatureService;
        this.props = props;

        this.relayedCounter = Counter.builder("smartpay.relay.sent").register(meterRegistry);
        this.failedCounter = Counter.builder("smartpay.relay.failed").register(meterRegistry);
    }

    /**
     * Signs a status the same way the PSP signs a browser return, so the store verifies both alike.
     *
     * @param webhookUrl store callback URL
     * @param orderId    merchant order id
     * @param status     PSP status as received
     * @param signingKey Base64 signing key
     * @return call to make
     */
    public RelayCall prepare(String webhookUrl, String orderId, String status, String signingKey) {
        String signature = signatureService.sign(List.of(orderId, status), signingKey);
        // values are expanded as URI variables so '+' and '&' are percent-encoded, not left to form decoding
        URI uri = UriComponentsBuilder.fromUriString(webhookUrl)
                .queryParam(ReturnParameters.ORDER_ID, "{orderId}")
                .queryParam(ReturnParameters.STATUS, "{status}")
                .queryParam(ReturnParameters.SIGNATURE, "{signature}")
                .encode()
                .buildAndExpand(Map.of("orderId", orderId, "status", status, "signature", signature))
                .toUri();
        return new RelayCall(orderId, status, uri);
    }

    /**
     * Starts a new batch of relay calls.
     *
     * @return empty batch
     */
    public RelayBatch newBatch() {
        return new RelayBatch(this, executor, props.getRelay().getTimeout());
    }

    void send(RelayCall call) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        restClient.get()
                .uri(call.uri())
                .headers(headers -> {
                    if (correlationId != null) {
                        headers.set(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId);
                    }
                })
                .retrieve()
                .toBodilessEntity();
    }

    void onRelayed(RelayCall call) {
        relayedCounter.increment();
        log.info("Relayed status. orderId={} status={}", call.orderId(), call.status());
    }

    void onFailed(RelayCall call, Throwable error) {
        failedCounter.increment();
        log.warn("Relay failed. orderId={} status={} error={}", call.orderId(), call.status(), error.toString());
    }
}
