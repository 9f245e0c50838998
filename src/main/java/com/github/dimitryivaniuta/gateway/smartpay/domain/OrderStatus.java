package com.github.dimitryivaniuta.gateway.smartpay.domain;

import java.util.Locale;

/**
 * Order status reported by the PSP.
 *
 * <p>{@link #IN_PROGRESS} is the only non-terminal status. Codes are stable and stored in the status log.</p>
 */
public enum OrderStatus {
    /** Paid. */
    COMPLETED(0),
    /** The customer did not finish in time. */
    EXPIRED(1),
    /** Still open at the PSP. */
    IN_PROGRESS(2),
    /** Cancelled by the customer. */
    CANCELLED(3),
    /** Anything the PSP sent that we do not recognise. */
    UNKNOWN(-1);

    private final int code;

    OrderStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    /**
     * Parses a PSP status string, case-insensitive.
     *
     * @param value raw status
     * @return status, {@link #UNKNOWN} when not recognised
     */
    public static OrderStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OrderStatus status : values()) {
            if (status != UNKNOWN && status.name().equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
