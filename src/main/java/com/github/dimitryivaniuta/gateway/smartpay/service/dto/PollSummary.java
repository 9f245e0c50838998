package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

/**
 * What one notification ping did.
 *
 * @param batchesFetched status batches fetched from the PSP
 * @param relayCalls     terminal results handed to the relay
 * @param inProgress     in-progress results that were only logged
 * @param relay          relay outcome
 * @param abortReason    why processing stopped early, {@code null} when it ran to completion
 */
public record PollSummary(
        int batchesFetched,
        int relayCalls,
        int inProgress,
        RelaySummary relay,
        String abortReason
) {

    public static PollSummary aborted(String reason) {
        return new PollSummary(0, 0, 0, RelaySummary.EMPTY, reason);
    }

    public boolean isAborted() {
        return abortReason != null;
    }
}
