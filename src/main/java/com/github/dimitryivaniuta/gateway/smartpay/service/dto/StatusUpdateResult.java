package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

/**
 * Result of a relayed status update.
 *
 * @param successful    true only for a verified completed payment
 * @param status        reason when not successful
 * @param invoiceNumber {@code order_id} of the request, when present
 */
public record StatusUpdateResult(boolean successful, String status, String invoiceNumber) {

    public static final String REQUEST_NOT_AVAILABLE = "Request not available; unable to process status update.";
    public static final String ILLEGAL_SIGNATURE = "Illegal signature received; unable to process status update.";
    public static final String CANCELLED = "User cancelled the order at the PSP.";
    public static final String EXPIRED = "The order expired at the PSP.";
    public static final String UNKNOWN_STATUS = "Unknown status; unable to process status update.";
}
