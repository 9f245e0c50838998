package com.github.dimitryivaniuta.gateway.smartpay.psp;

/**
 * Signed PSP data did not match the signature computed with our signing key.
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
