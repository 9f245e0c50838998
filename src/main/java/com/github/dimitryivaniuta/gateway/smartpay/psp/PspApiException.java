package com.github.dimitryivaniuta.gateway.smartpay.psp;

/**
 * The PSP answered with an error other than an authentication failure, or returned an unusable body.
 */
public class PspApiException extends RuntimeException {

    private final int statusCode;

    public PspApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
