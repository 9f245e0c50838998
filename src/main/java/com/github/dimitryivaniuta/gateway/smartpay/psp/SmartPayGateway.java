package com.github.dimitryivaniuta.gateway.smartpay.psp;

import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.ApiNotification;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrder;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResponse;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderStatusResponse;

/**
 * Transport to the PSP API. Credentials are passed per call; implementations hold no per-merchant state.
 *
 * <p>All methods throw {@link PspAuthenticationException} when the PSP rejects the token and
 * {@link PspApiException} for any other error response.</p>
 */
public interface SmartPayGateway {

    /**
     * Exchanges the long-lived refresh token for an access token.
     *
     * @param refreshToken refresh token
     * @param environment  target environment
     * @return access token
     */
    AccessToken refreshAccessToken(String refreshToken, GatewayEnvironment environment);

    /**
     * Announces an order and returns the payment page for the customer.
     *
     * @param order       order to announce
     * @param accessToken access token
     * @param environment target environment
     * @return PSP response with the redirect URL
     */
    MerchantOrderResponse announce(MerchantOrder order, String accessToken, GatewayEnvironment environment);

    /**
     * Fetches the next batch of order results for a notification.
     *
     * @param notification webhook notification; its authentication token authorises the call
     * @param environment  target environment
     * @return status batch, not yet verified
     */
    MerchantOrderStatusResponse retrieveAnnouncement(ApiNotification notification, GatewayEnvironment environment);
}
