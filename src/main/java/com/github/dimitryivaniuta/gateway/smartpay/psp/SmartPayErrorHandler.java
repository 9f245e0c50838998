package com.github.dimitryivaniuta.gateway.smartpay.psp;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResponseErrorHandler;

/**
 * Maps PSP error responses: 401 to {@link PspAuthenticationException}, any other 4xx/5xx to {@link PspApiException}.
 */
public class SmartPayErrorHandler implements ResponseErrorHandler {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    @Override
    public boolean hasError(ClientHttpResponse response) throws IOException {
        return response.getStatusCode().isError();
    }

    @Override
    public void handleError(ClientHttpResponse response) throws IOException {
        raise(null, response);
    }

    @Override
    public void handleError(URI url, HttpMethod method, ClientHttpResponse response) throws IOException {
        raise(method + " " + url.getPath(), response);
    }

    private void raise(String call, ClientHttpResponse response) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        String prefix = call == null ? "PSP" : "PSP " + call;
        if (status.value() == HttpStatus.UNAUTHORIZED.value()) {
            throw new PspAuthenticationException(prefix + " rejected the token");
        }
        throw new PspApiException(status.value(), prefix + " failed with " + status.value() + ": " + body(response));
    }

    private static String body(ClientHttpResponse response) {
        try {
            String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
            return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) : body;
        } catch (IOException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }
}
