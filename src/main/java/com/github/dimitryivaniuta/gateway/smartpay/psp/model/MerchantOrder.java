package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Order announced to the PSP at checkout.
 *
 * @param merchantOrderId   invoice number assigned by the store
 * @param amount            total amount
 * @param merchantReturnUrl where the PSP sends the browser afterwards
 * @param billingDetail     billing address
 * @param shippingDetail    shipping address; the billing object when none was given
 * @param orderItems        basket lines
 * @param paymentBrand      brand the customer chose
 * @param paymentBrandForce always {@link PaymentBrandForce#FORCE_ALWAYS}
 * @param timestamp         creation time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MerchantOrder(
        String merchantOrderId,
        Money amount,
        @JsonProperty("merchantReturnURL") String merchantReturnUrl,
        Address billingDetail,
        Address shippingDetail,
        List<OrderItem> orderItems,
        PaymentBrand paymentBrand,
        PaymentBrandForce paymentBrandForce,
        OffsetDateTime timestamp
) {

    public MerchantOrder {
        orderItems = List.copyOf(orderItems);
    }
}
