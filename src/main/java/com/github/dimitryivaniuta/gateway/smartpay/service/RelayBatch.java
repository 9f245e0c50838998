package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.service.dto.RelayCall;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.RelaySummary;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relay calls started for one notification. Not thread-safe; used by the notification thread only.
 */
public class RelayBatch {

    private static final Logger log = LoggerFactory.getLogger(RelayBatch.class);

    private final RelayDispatcher dispatcher;
    private final Executor executor;
    private final Duration callTimeout;
    private final List<CompletableFuture<Boolean>> calls = new ArrayList<>();

    RelayBatch(RelayDispatcher dispatcher, Executor executor, Duration callTimeout) {
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.callTimeout = callTimeout;
    }

    /**
     * Starts a relay call. When the relay pool is saturated the call runs on the calling thread.
     *
     * @param call call to make
     */
    public void submit(RelayCall call) {
        CompletableFuture<Boolean> outcome = CompletableFuture
                .runAsync(() -> dispatcher.send(call), executor)
                .orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        dispatcher.onRelayed(call);
                        return Boolean.TRUE;
                    }
                    dispatcher.onFailed(call, unwrap(error));
                    return Boolean.FALSE;
                });
        calls.add(outcome);
    }

    public int size() {
        return calls.size();
    }

    /**
     * Waits for the started calls.
     *
     * @param timeout how long to wait in total
     * @return counts of relayed, failed and still running calls
     */
    public RelaySummary awaitCompletion(Duration timeout) {
        if (calls.isEmpty()) {
            return RelaySummary.EMPTY;
        }
        try {
            CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Relay batch still running after {}", timeout);
        } catch (ExecutionException e) {
            // handled futures never complete exceptionally
            throw new IllegalStateException("Relay outcome failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int relayed = 0;
        int failed = 0;
        int unfinished = 0;
        for (CompletableFuture<Boolean> call : calls) {
            if (!call.isDone()) {
                unfinished++;
            } else if (Boolean.TRUE.equals(call.getNow(Boolean.FALSE))) {
                relayed++;
            } else {
                failed++;
            }
        }
        return new RelaySummary(relayed, failed, unfinished);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
