package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Status of one order inside a status batch.
 */
public record MerchantOrderResult(
        String merchantOrderId,
        String omnikassaOrderId,
        Integer poiId,
        String orderStatus,
        String orderStatusDateTime,
        String errorCode,
        Money paidAmount,
        Money totalAmount
) {

    public OrderStatus status() {
        return OrderStatus.fromValue(orderStatus);
    }

    List<String> signatureFields() {
        return Arrays.asList(
                merchantOrderId,
                omnikassaOrderId,
                Objects.toString(poiId, null),
                orderStatus,
                orderStatusDateTime,
                errorCode,
                paidAmount == null ? null : paidAmount.currency(),
                paidAmount == null ? null : String.valueOf(paidAmount.amount()),
                totalAmount == null ? null : totalAmount.currency(),
                totalAmount == null ? null : String.valueOf(totalAmount.amount())
        );
    }
}
