package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import com.github.dimitryivaniuta.gateway.smartpay.psp.InvalidSignatureException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.PspApiException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.PspAuthenticationException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SignatureService;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SmartPayGateway;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.ApiNotification;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResult;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderStatusResponse;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.PollSummary;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ProviderSettings;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.RelaySummary;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

/**
 * Handles a PSP webhook ping: verifies it, drains the queued order results and relays the terminal ones.
 *
 * <p>Verification failures stop processing without side effects beyond what was already relayed.
 * Each ping is handled on its own; the status log is the only shared state.</p>
 */
@Service
public class NotificationPoller {

    private static final Logger log = LoggerFactory.getLogger(NotificationPoller.class);

    static final String UNDECODABLE = "undecodable notification";
    static final String INVALID_NOTIFICATION_SIGNATURE = "invalid notification signature";
    static final String INVALID_BATCH_SIGNATURE = "invalid status batch signature";
    static final String FETCH_FAILED = "status batch fetch failed";
    static final String MAX_BATCHES_REACHED = "maximum number of status batches reached";

    private final ProviderSettingsResolver settingsResolver;
    private final SmartPayGateway gateway;
    private final SignatureService signatureService;
    private final RelayDispatcher relayDispatcher;
    private final PaymentStatusLogger statusLogger;
    private final ObjectMapper objectMapper;
    private final AppProperties props;

    public NotificationPoller(
            ProviderSettingsResolver settingsResolver,
            SmartPayGateway gateway,
            SignatureService signatureService,
            RelayDispatcher relayDispatcher,
            PaymentStatusLogger statusLogger,
            ObjectMapper objectMapper,
            AppProperties props
    ) {
        this.settingsResolver = settingsResolver;
        this.gateway = gateway;
        this.signatureService = signatureService;
        this.relayDispatcher = relayDispatcher;
        this.statusLogger = statusLogger;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    /**
     * Processes one webhook body.
     *
     * @param providerId PSP account
     * @param body       raw JSON body of the webhook call
     * @return what was done; never throws for PSP or relay failures
     * @throws ProviderNotFoundException when the provider does not exist
     */
    public PollSummary handleNotification(Long providerId, String body) {
        ProviderSettings settings = settingsResolver.resolve(providerId);

        Optional<ApiNotification> decoded = decode(body);
        if (decoded.isEmpty()) {
            log.warn("Ignoring notification. provider={} reason={}", providerId, UNDECODABLE);
            return PollSummary.aborted(UNDECODABLE);
        }
        ApiNotification notification = decoded.get();
        String signingKey = settings.credentials().signingKey();

        try {
            signatureService.verify(notification, signingKey);
        } catch (InvalidSignatureException e) {
            log.warn("Ignoring notification. provider={} event={} reason={}", providerId, notification.eventName(), e.getMessage());
            return PollSummary.aborted(INVALID_NOTIFICATION_SIGNATURE);
        }

        boolean relayEnabled = settings.webhookUrl() != null && !settings.webhookUrl().isBlank();
        if (!relayEnabled) {
            log.warn("No webhook URL configured; terminal results will not be relayed. provider={}", providerId);
        }

        RelayBatch relay = relayDispatcher.newBatch();
        int maxBatches = props.getNotification().getMaxBatches();
        int batches = 0;
        int inProgress = 0;
        String abortReason = null;

        boolean more;
        do {
            if (batches >= maxBatches) {
                abortReason = MAX_BATCHES_REACHED;
                log.warn("Stopped fetching status batches. provider={} batches={}", providerId, batches);
                break;
            }

            MerchantOrderStatusResponse response;
            try {
                response = gateway.retrieveAnnouncement(notification, settings.gatewayEnvironment());
                batches++;
                signatureService.verify(response, signingKey);
            } catch (InvalidSignatureException e) {
                abortReason = INVALID_BATCH_SIGNATURE;
                log.warn("Rejected status batch. provider={} batch={} reason={}", providerId, batches, e.getMessage());
                break;
            } catch (PspAuthenticationException | PspApiException | RestClientException e) {
                abortReason = FETCH_FAILED;
                log.error("Fetching status batch failed. provider={} event={} error={}",
                        providerId, notification.eventName(), e.getMessage());
                break;
            }

            for (MerchantOrderResult result : response.orderResults()) {
                OrderStatus status = result.status();
                if (!status.isTerminal()) {
                    statusLogger.log(settings.title(), result.merchantOrderId(), status, StatusSource.NOTIFICATION);
                    inProgress++;
                    continue;
                }
                if (relayEnabled) {
                    relay.submit(relayDispatcher.prepare(
                            settings.webhookUrl(), result.merchantOrderId(), result.orderStatus(), signingKey));
                }
            }
            more = response.moreOrderResultsAvailable();
        } while (more);

        RelaySummary relaySummary = relay.awaitCompletion(props.getRelay().getAwaitTimeout());
        log.info("Notification handled. provider={} event={} batches={} inProgress={} relayed={} failed={} unfinished={} aborted={}",
                providerId, notification.eventName(), batches, inProgress,
                relaySummary.relayed(), relaySummary.failed(), relaySummary.unfinished(), abortReason);

        return new PollSummary(batches, relay.size(), inProgress, relaySummary, abortReason);
    }

    private Optional<ApiNotification> decode(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(body, ApiNotification.class));
        } catch (JsonProcessingException e) {
            log.debug("Notification body is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
