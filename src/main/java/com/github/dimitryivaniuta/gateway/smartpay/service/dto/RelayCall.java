package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

import java.net.URI;

/**
 * One signed status forwarded to the store callback.
 *
 * @param orderId merchant order id
 * @param status  PSP status
 * @param uri     full callback URI including the signed query
 */
public record RelayCall(String orderId, String status, URI uri) {}
