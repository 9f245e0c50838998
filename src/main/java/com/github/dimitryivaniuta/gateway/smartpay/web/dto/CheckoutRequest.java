package com.github.dimitryivaniuta.gateway.smartpay.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/**
 * Checkout request from the storefront.
 *
 * @param invoiceNumber merchant order id, unique per checkout attempt
 * @param paymentMethod payment method name, e.g. {@code ideal}
 * @param customer      customer details; shipping fields carry the {@code shipping_} prefix
 * @param baskets       baskets to pay
 */
public record CheckoutRequest(
        @NotBlank @Size(max = 128) String invoiceNumber,
        @NotBlank @Size(max = 64) String paymentMethod,
        @NotNull Map<String, String> customer,
        @NotEmpty List<@Valid BasketDto> baskets
) {}
