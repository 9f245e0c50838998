package com.github.dimitryivaniuta.gateway.smartpay.service;

/**
 * No PSP account is configured under the requested id.
 */
public class ProviderNotFoundException extends RuntimeException {

    public ProviderNotFoundException(Long providerId) {
        super("Payment service provider " + providerId + " not found");
    }
}
