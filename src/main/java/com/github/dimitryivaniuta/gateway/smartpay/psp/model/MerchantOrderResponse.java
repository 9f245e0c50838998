package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

/**
 * PSP answer to an announced order.
 *
 * @param redirectUrl      payment page for the customer
 * @param omnikassaOrderId order id assigned by the PSP
 */
public record MerchantOrderResponse(String redirectUrl, String omnikassaOrderId) {}
