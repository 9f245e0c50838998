package com.github.dimitryivaniuta.gateway.smartpay.service;

/**
 * Why a store basket could not be expressed as a PSP order.
 */
public enum MappingErrorKind {
    UNSUPPORTED_COUNTRY,
    UNSUPPORTED_BRAND,
    /** A basket line quantity or price is not a number. */
    INVALID_LINE_VALUE
}
