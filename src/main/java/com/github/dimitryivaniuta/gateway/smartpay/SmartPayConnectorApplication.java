package com.github.dimitryivaniuta.gateway.smartpay;

import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point for the Smart Pay PSP connector.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AppProperties.class)
public class SmartPayConnectorApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(SmartPayConnectorApplication.class, args);
    }
}
