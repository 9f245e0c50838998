package com.github.dimitryivaniuta.gateway.smartpay.domain;

/**
 * Where an observed status came from.
 */
public enum StatusSource {
    /** Browser came back from the PSP. */
    RETURN,
    /** Signed status update received on the store callback. */
    STATUS_UPDATE,
    /** Status batch fetched after a PSP webhook notification. */
    NOTIFICATION
}
