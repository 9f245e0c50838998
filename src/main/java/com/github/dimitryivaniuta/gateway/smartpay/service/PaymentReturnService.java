package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import com.github.dimitryivaniuta.gateway.smartpay.psp.InvalidSignatureException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SignatureService;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.PaymentCompletedResponse;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ProviderSettings;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ReturnParameters;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.StatusUpdateResult;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Verifies signed {@code order_id}/{@code status} pairs coming back from the PSP.
 *
 * <p>An empty {@link ReturnParameters} means no HTTP request is bound to the current thread.</p>
 */
@Service
public class PaymentReturnService {

    private static final Logger log = LoggerFactory.getLogger(PaymentReturnService.class);

    private final ProviderSettingsResolver settingsResolver;
    private final SignatureService signatureService;
    private final PaymentStatusLogger statusLogger;

    public PaymentReturnService(
            ProviderSettingsResolver settingsResolver,
            SignatureService signatureService,
            PaymentStatusLogger statusLogger
    ) {
        this.settingsResolver = settingsResolver;
        this.signatureService = signatureService;
        this.statusLogger = statusLogger;
    }

    /**
     * Picks where to send a customer coming back from the PSP.
     *
     * @param providerId PSP account
     * @param parameters signed return parameters
     * @return success URL for completed orders, pending URL (or success URL) for orders in progress,
     * fail URL for everything else including bad signatures
     */
    public String redirectUrlOnReturn(Long providerId, Optional<ReturnParameters> parameters) {
        ProviderSettings settings = settingsResolver.resolve(providerId);
        if (parameters.isEmpty()) {
            return settings.failUrl();
        }

        Optional<PaymentCompletedResponse> verified = verify(settings, parameters.get());
        if (verified.isEmpty()) {
            return settings.failUrl();
        }

        PaymentCompletedResponse response = verified.get();
        OrderStatus status = response.orderStatus();
        statusLogger.log(settings.title(), response.orderId(), status, StatusSource.RETURN);

        switch (status) {
            case COMPLETED:
                return settings.successUrl();
            case IN_PROGRESS:
                return settings.pendingOrSuccessUrl();
            default:
                return settings.failUrl();
        }
    }

    /**
     * Handles a status update relayed to the store.
     *
     * @param providerId PSP account
     * @param parameters signed parameters
     * @return successful only for a verified COMPLETED status
     */
    public StatusUpdateResult processStatusUpdate(Long providerId, Optional<ReturnParameters> parameters) {
        if (parameters.isEmpty()) {
            return new StatusUpdateResult(false, StatusUpdateResult.REQUEST_NOT_AVAILABLE, null);
        }

        ProviderSettings settings = settingsResolver.resolve(providerId);
        String invoiceNumber = parameters.get().orderId();

        Optional<PaymentCompletedResponse> verified = verify(settings, parameters.get());
        if (verified.isEmpty()) {
            return new StatusUpdateResult(false, StatusUpdateResult.ILLEGAL_SIGNATURE, invoiceNumber);
        }

        OrderStatus status = verified.get().orderStatus();
        statusLogger.log(settings.title(), invoiceNumber, status, StatusSource.STATUS_UPDATE);
        log.info("Status update received. provider={} invoice={} status={}", providerId, invoiceNumber, status);

        switch (status) {
            case COMPLETED:
                return new StatusUpdateResult(true, null, invoiceNumber);
            case CANCELLED:
                return new StatusUpdateResult(false, StatusUpdateResult.CANCELLED, invoiceNumber);
            case EXPIRED:
                return new StatusUpdateResult(false, StatusUpdateResult.EXPIRED, invoiceNumber);
            default:
                return new StatusUpdateResult(false, StatusUpdateResult.UNKNOWN_STATUS, invoiceNumber);
        }
    }

    private Optional<PaymentCompletedResponse> verify(ProviderSettings settings, ReturnParameters parameters) {
        PaymentCompletedResponse response = parameters.toResponse();
        try {
            signatureService.verify(response, settings.credentials().signingKey());
            return Optional.of(response);
        } catch (InvalidSignatureException e) {
            log.warn("Rejected signed return. provider={} orderId={} reason={}",
                    settings.id(), parameters.orderId(), e.getMessage());
            return Optional.empty();
        }
    }
}
