package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

/**
 * Outcome of one relay fan-out.
 *
 * @param relayed    calls answered with 2xx
 * @param failed     calls that errored or timed out
 * @param unfinished calls still running when waiting stopped
 */
public record RelaySummary(int relayed, int failed, int unfinished) {

    public static final RelaySummary EMPTY = new RelaySummary(0, 0, 0);

    public int total() {
        return relayed + failed + unfinished;
    }
}
