package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

/**
 * PSP credentials of one environment. Either value may be {@code null} when it is not configured.
 *
 * @param refreshToken refresh token
 * @param signingKey   Base64 signing key
 */
public record Credentials(String refreshToken, String signingKey) {

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean hasSigningKey() {
        return signingKey != null && !signingKey.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[refreshToken=" + (hasRefreshToken() ? "***" : "<none>")
                + ", signingKey=" + (hasSigningKey() ? "***" : "<none>") + "]";
    }
}
