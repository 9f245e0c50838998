package com.github.dimitryivaniuta.gateway.smartpay.config;

import com.github.dimitryivaniuta.gateway.smartpay.psp.SmartPayErrorHandler;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP clients for the PSP API and for relay calls to the store callback.
 *
 * <p>Both start from the Boot-provided (prototype) {@link RestClient.Builder}, so they do not share state.</p>
 */
@Configuration
public class RestClientConfig {

    public static final String SMART_PAY_REST_CLIENT = "smartPayRestClient";
    public static final String RELAY_REST_CLIENT = "relayRestClient";

    /**
     * PSP API client. Base URLs differ per gateway environment, so requests use absolute URIs.
     *
     * @param builder boot builder
     * @param props   application properties
     * @return rest client
     */
    @Bean(name = SMART_PAY_REST_CLIENT)
    public RestClient smartPayRestClient(RestClient.Builder builder, AppProperties props) {
        AppProperties.SmartPay smartPay = props.getSmartPay();
        return builder
                .requestFactory(requestFactory(smartPay.getConnectTimeout(), smartPay.getReadTimeout()))
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .defaultStatusHandler(new SmartPayErrorHandler())
                .build();
    }

    /**
     * Relay client; a stalled store callback can hold a relay thread for at most the relay timeout.
     *
     * @param builder boot builder
     * @param props   application properties
     * @return rest client
     */
    @Bean(name = RELAY_REST_CLIENT)
    public RestClient relayRestClient(RestClient.Builder builder, AppProperties props) {
        Duration timeout = props.getRelay().getTimeout();
        return builder
                .requestFactory(requestFactory(timeout, timeout))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
