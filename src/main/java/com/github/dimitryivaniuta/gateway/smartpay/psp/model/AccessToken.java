package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

/**
 * Short-lived access token obtained with the refresh token.
 *
 * @param token            bearer token
 * @param validUntil       expiry as reported by the PSP
 * @param durationInMillis validity in milliseconds
 */
public record AccessToken(String token, String validUntil, Long durationInMillis) {}
