package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.psp.AccessTokenService;
import com.github.dimitryivaniuta.gateway.smartpay.psp.GatewayEnvironment;
import com.github.dimitryivaniuta.gateway.smartpay.psp.PspApiException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.PspAuthenticationException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SmartPayGateway;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrder;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResponse;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.DetailItem;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.PaymentRequestResult;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ProviderSettings;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ShoppingBasket;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Announces checkout orders at the PSP.
 *
 * <p>Every failure ends as an unsuccessful {@link PaymentRequestResult} redirecting to the fail URL;
 * nothing is retried. A rejected access token is evicted so the next checkout fetches a fresh one.</p>
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    static final String AUTHENTICATION_FAILED = "Failed to authenticate with the Smart Pay API";
    static final String PSP_UNAVAILABLE = "The Smart Pay API could not process the order";

    private final ProviderSettingsResolver settingsResolver;
    private final OrderMapper orderMapper;
    private final AccessTokenService accessTokenService;
    private final SmartPayGateway gateway;

    private final Counter announcedCounter;
    private final Counter rejectedCounter;

    public CheckoutService(
            ProviderSettingsResolver settingsResolver,
            OrderMapper orderMapper,
            AccessTokenService accessTokenService,
            SmartPayGateway gateway,
            MeterRegistry meterRegistry
    ) {
        this.settingsResolver = settingsResolver;
        this.orderMapper = orderMapper;
        this.accessTokenService = accessTokenService;
        this.gateway = gateway;

        this.announcedCounter = Counter.builder("smartpay.checkout.announced").register(meterRegistry);
        this.rejectedCounter = Counter.builder("smartpay.checkout.rejected").register(meterRegistry);
    }

    /**
     * Announces an order and returns where to send the customer.
     *
     * @param providerId    PSP account
     * @param baskets       baskets being paid
     * @param customer      customer details
     * @param paymentMethod store payment method name
     * @param invoiceNumber merchant order id
     * @return redirect to the PSP payment page, or to the fail URL with an error message
     * @throws ProviderNotFoundException when the provider does not exist
     */
    public PaymentRequestResult handlePaymentRequest(
            Long providerId,
            List<ShoppingBasket> baskets,
            DetailItem customer,
            String paymentMethod,
            String invoiceNumber
    ) {
        ProviderSettings settings = settingsResolver.resolve(providerId);

        MerchantOrder order;
        try {
            order = orderMapper.buildOrder(baskets, customer, settings.merchantReturnUrl(), invoiceNumber, paymentMethod);
        } catch (MappingException e) {
            log.warn("Checkout rejected. provider={} invoice={} kind={} reason={}",
                    providerId, invoiceNumber, e.getKind(), e.getMessage());
            rejectedCounter.increment();
            return PaymentRequestResult.failed(settings.failUrl(), e.getMessage());
        }

        if (!settings.credentials().hasRefreshToken()) {
            log.error("No refresh token configured. provider={} environment={}", providerId, settings.gatewayEnvironment());
            rejectedCounter.increment();
            return PaymentRequestResult.failed(settings.failUrl(), AUTHENTICATION_FAILED);
        }

        String refreshToken = settings.credentials().refreshToken();
        GatewayEnvironment environment = settings.gatewayEnvironment();
        try {
            AccessToken accessToken = accessTokenService.accessToken(refreshToken, environment);
            MerchantOrderResponse response = gateway.announce(order, accessToken.token(), environment);

            log.info("Order announced. provider={} invoice={} omnikassaOrderId={} amount={}",
                    providerId, invoiceNumber, response.omnikassaOrderId(), order.amount().amount());
            announcedCounter.increment();
            return PaymentRequestResult.redirect(response.redirectUrl());
        } catch (PspAuthenticationException e) {
            accessTokenService.evict(refreshToken, environment);
            log.warn("PSP authentication failed. provider={} invoice={} error={}", providerId, invoiceNumber, e.getMessage());
            rejectedCounter.increment();
            return PaymentRequestResult.failed(settings.failUrl(), AUTHENTICATION_FAILED);
        } catch (PspApiException e) {
            log.error("PSP rejected order. provider={} invoice={} status={} error={}",
                    providerId, invoiceNumber, e.getStatusCode(), e.getMessage());
            rejectedCounter.increment();
            return PaymentRequestResult.failed(settings.failUrl(), PSP_UNAVAILABLE);
        }
    }
}
