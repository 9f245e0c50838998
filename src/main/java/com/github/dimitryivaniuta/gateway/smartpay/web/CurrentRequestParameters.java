package com.github.dimitryivaniuta.gateway.smartpay.web;

import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ReturnParameters;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Reads the signed PSP parameters of the HTTP request bound to the current thread.
 */
@Component
public class CurrentRequestParameters {

    /**
     * @return the {@code order_id}, {@code status} and {@code signature} parameters (each possibly {@code null}),
     * empty when no request is bound
     */
    public Optional<ReturnParameters> returnParameters() {
        return currentRequest().map(request -> new ReturnParameters(
                request.getParameter(ReturnParameters.ORDER_ID),
                request.getParameter(ReturnParameters.STATUS),
                request.getParameter(ReturnParameters.SIGNATURE)
        ));
    }

    /**
     * @return the {@code order_id} parameter, empty when absent or when no request is bound
     */
    public Optional<String> invoiceNumber() {
        return currentRequest()
                .map(request -> request.getParameter(ReturnParameters.ORDER_ID))
                .filter(value -> !value.isBlank());
    }

    private static Optional<HttpServletRequest> currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            return Optional.of(((ServletRequestAttributes) attributes).getRequest());
        }
        return Optional.empty();
    }
}
