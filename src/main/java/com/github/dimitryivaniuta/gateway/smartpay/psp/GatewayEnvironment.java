package com.github.dimitryivaniuta.gateway.smartpay.psp;

/**
 * PSP endpoint a request is sent to.
 */
public enum GatewayEnvironment {
    SANDBOX,
    PRODUCTION
}
