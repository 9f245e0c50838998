package com.github.dimitryivaniuta.gateway.smartpay.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs PSP endpoint calls with status and duration. The query string is not logged, so signatures never
 * reach the log; only {@code order_id} is.
 */
@Slf4j
@Component
public class PspRequestLoggingFilter extends OncePerRequestFilter {

    static final String PSP_PATH_PREFIX = "/api/psp/";

    private final CurrentRequestParameters requestParameters;

    public PspRequestLoggingFilter(CurrentRequestParameters requestParameters) {
        this.requestParameters = requestParameters;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(PSP_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long t0 = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            log.info("PSP {} {} -> {} in {}ms orderId={}", req.getMethod(), req.getRequestURI(), res.getStatus(), ms,
                    requestParameters.invoiceNumber().orElse("-"));
        }
    }
}
