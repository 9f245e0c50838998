package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

/**
 * Outcome of a checkout.
 *
 * @param successful   whether the order was announced
 * @param action       always {@link PaymentRequestAction#REDIRECT}
 * @param actionData   PSP payment page, or the fail URL
 * @param errorMessage reason when not successful
 */
public record PaymentRequestResult(
        boolean successful,
        PaymentRequestAction action,
        String actionData,
        String errorMessage
) {

    public static PaymentRequestResult redirect(String url) {
        return new PaymentRequestResult(true, PaymentRequestAction.REDIRECT, url, null);
    }

    public static PaymentRequestResult failed(String failUrl, String errorMessage) {
        return new PaymentRequestResult(false, PaymentRequestAction.REDIRECT, failUrl, errorMessage);
    }
}
