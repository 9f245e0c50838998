package com.github.dimitryivaniuta.gateway.smartpay.service;

/**
 * Store data has no counterpart in the PSP vocabulary.
 */
public class MappingException extends RuntimeException {

    private final MappingErrorKind kind;

    public MappingException(MappingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MappingErrorKind getKind() {
        return kind;
    }
}
