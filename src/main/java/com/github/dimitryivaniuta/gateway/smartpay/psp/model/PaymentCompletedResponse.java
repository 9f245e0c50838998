package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.psp.Signable;
import java.util.Arrays;
import java.util.List;

/**
 * Signed {@code order_id}/{@code status} pair on the browser return and on relayed status updates.
 *
 * @param orderId   merchant order id
 * @param status    raw status
 * @param signature signature over order id and status
 */
public record PaymentCompletedResponse(String orderId, String status, String signature) implements Signable {

    @Override
    public List<String> signatureFields() {
        return Arrays.asList(orderId, status);
    }

    public OrderStatus orderStatus() {
        return OrderStatus.fromValue(status);
    }
}
