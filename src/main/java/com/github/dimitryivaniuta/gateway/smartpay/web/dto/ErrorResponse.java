package com.github.dimitryivaniuta.gateway.smartpay.web.dto;

import com.github.dimitryivaniuta.gateway.smartpay.web.CorrelationIdFilter;
import java.time.Instant;
import org.slf4j.MDC;

/**
 * Error body of the storefront-facing endpoints.
 *
 * @param code          machine-readable code
 * @param message       human readable message
 * @param correlationId id of the failed request, for matching it with the server log
 * @param timestamp     event time
 */
public record ErrorResponse(String code, String message, String correlationId, Instant timestamp) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, MDC.get(CorrelationIdFilter.MDC_KEY), Instant.now());
    }
}
