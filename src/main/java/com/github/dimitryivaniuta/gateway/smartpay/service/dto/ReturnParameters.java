package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

import com.github.dimitryivaniuta.gateway.smartpay.psp.model.PaymentCompletedResponse;

/**
 * The signed query parameters on a browser return or status update.
 *
 * @param orderId   {@code order_id}
 * @param status    {@code status}
 * @param signature {@code signature}
 */
public record ReturnParameters(String orderId, String status, String signature) {

    public static final String ORDER_ID = "order_id";
    public static final String STATUS = "status";
    public static final String SIGNATURE = "signature";

    public PaymentCompletedResponse toResponse() {
        return new PaymentCompletedResponse(orderId, status, signature);
    }
}
