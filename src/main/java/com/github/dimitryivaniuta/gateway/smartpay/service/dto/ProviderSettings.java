package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

import com.github.dimitryivaniuta.gateway.smartpay.psp.GatewayEnvironment;

/**
 * Resolved settings of one PSP account for the current deployment environment.
 */
public record ProviderSettings(
        Long id,
        String title,
        String successUrl,
        String failUrl,
        String pendingUrl,
        String returnUrl,
        String webhookUrl,
        Credentials credentials,
        GatewayEnvironment gatewayEnvironment
) {

    /**
     * URL the PSP sends the browser back to.
     *
     * @return return URL, or the success URL when none is configured
     */
    public String merchantReturnUrl() {
        return isBlank(returnUrl) ? successUrl : returnUrl;
    }

    /**
     * Destination for orders still in progress.
     *
     * @return pending URL, or the success URL when none is configured
     */
    public String pendingOrSuccessUrl() {
        return isBlank(pendingUrl) ? successUrl : pendingUrl;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
