package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

/**
 * Whether the customer may pick another brand on the PSP page.
 */
public enum PaymentBrandForce {
    FORCE_ONCE,
    FORCE_ALWAYS
}
