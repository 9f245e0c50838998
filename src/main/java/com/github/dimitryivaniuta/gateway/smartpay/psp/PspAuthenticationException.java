package com.github.dimitryivaniuta.gateway.smartpay.psp;

/**
 * The PSP rejected our refresh or access token, or no credentials are configured.
 */
public class PspAuthenticationException extends RuntimeException {

    public PspAuthenticationException(String message) {
        super(message);
    }

    public PspAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
