package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

/**
 * What the storefront does with {@link PaymentRequestResult#actionData()}.
 */
public enum PaymentRequestAction {
    REDIRECT
}
