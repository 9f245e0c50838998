package com.github.dimitryivaniuta.gateway.smartpay.psp;

import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.config.RestClientConfig;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.ApiNotification;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrder;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResponse;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * {@link SmartPayGateway} over the PSP REST API.
 */
@Component
public class RestSmartPayGateway implements SmartPayGateway {

    private static final Logger log = LoggerFactory.getLogger(RestSmartPayGateway.class);

    static final String REFRESH_PATH = "gatekeeper/refresh";
    static final String ORDER_PATH = "order/server/api/v2/order";
    static final String EVENT_RESULTS_PATH = "order/server/api/events/results/{eventName}";

    private final RestClient restClient;
    private final AppProperties props;

    /**
     * Creates the gateway.
     *
     * @param restClient PSP rest client
     * @param props      application properties
     */
    public RestSmartPayGateway(
            @Qualifier(RestClientConfig.SMART_PAY_REST_CLIENT) RestClient restClient,
            AppProperties props
    ) {
        this.restClient = restClient;
        this.props = props;
    }

    @Override
    public AccessToken refreshAccessToken(String refreshToken, GatewayEnvironment environment) {
        AccessToken token = restClient.get()
                .uri(props.getSmartPay().baseUrl(environment) + REFRESH_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearer(refreshToken))
                .retrieve()
                .body(AccessToken.class);

        if (token == null || token.token() == null || token.token().isBlank()) {
            throw new PspApiException(200, "PSP returned no access token");
        }
        log.debug("Access token refreshed. environment={} validUntil={}", environment, token.validUntil());
        return token;
    }

    @Override
    public MerchantOrderResponse announce(MerchantOrder order, String accessToken, GatewayEnvironment environment) {
        MerchantOrderResponse response = restClient.post()
                .uri(props.getSmartPay().baseUrl(environment) + ORDER_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearer(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .body(order)
                .retrieve()
                .body(MerchantOrderResponse.class);

        if (response == null || response.redirectUrl() == null || response.redirectUrl().isBlank()) {
            throw new PspApiException(200, "PSP returned no redirect URL for order " + order.merchantOrderId());
        }
        return response;
    }

    @Override
    public MerchantOrderStatusResponse retrieveAnnouncement(ApiNotification notification, GatewayEnvironment environment) {
        MerchantOrderStatusResponse response = restClient.get()
                .uri(props.getSmartPay().baseUrl(environment) + EVENT_RESULTS_PATH, notification.eventName())
                .header(HttpHeaders.AUTHORIZATION, bearer(notification.authentication()))
                .retrieve()
                .body(MerchantOrderStatusResponse.class);

        if (response == null) {
            throw new PspApiException(200, "PSP returned an empty status batch for event " + notification.eventName());
        }
        return response;
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
