package com.github.dimitryivaniuta.gateway.smartpay.config;

import com.github.dimitryivaniuta.gateway.smartpay.psp.GatewayEnvironment;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    /**
     * Deployment environment; decides between test and live credentials and the PSP endpoint.
     */
    private DeploymentEnvironment environment = DeploymentEnvironment.DEVELOPMENT;

    private final SmartPay smartPay = new SmartPay();
    private final Relay relay = new Relay();
    private final Notification notification = new Notification();
    private final Secrets secrets = new Secrets();
    private final Outbox outbox = new Outbox();

    @Getter
    @Setter
    public static class SmartPay {
        /**
         * Base URL of the PSP sandbox API (trailing slash included).
         */
        private String sandboxUrl = "https://betalen.rabobank.nl/omnikassa-api-sandbox/";

        /**
         * Base URL of the PSP production API (trailing slash included).
         */
        private String productionUrl = "https://betalen.rabobank.nl/omnikassa-api/";

        /**
         * How long an access token stays cached. Must stay below the token validity the PSP reports.
         */
        private Duration accessTokenTtl = Duration.ofMinutes(10);

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        /**
         * Resolves the base URL for the given gateway environment.
         *
         * @param environment gateway environment
         * @return base URL
         */
        public String baseUrl(GatewayEnvironment environment) {
            return environment == GatewayEnvironment.PRODUCTION ? productionUrl : sandboxUrl;
        }
    }

    @Getter
    @Setter
    public static class Relay {
        /**
         * Max number of relay calls in flight at once.
         */
        private int maxConcurrency = 4;

        /**
         * Relay calls waiting for a free thread; the submitting thread runs the call when full.
         */
        private int queueCapacity = 100;

        /**
         * Per-call timeout (connect, read and overall).
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * How long one notification waits for its relay fan-out before logging it as unfinished.
         */
        private Duration awaitTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Notification {
        /**
         * Upper bound of status batches fetched for a single notification.
         */
        private int maxBatches = 100;
    }

    @Getter
    @Setter
    public static class Secrets {
        /**
         * Base64-encoded AES-256 key used to decrypt stored PSP secrets.
         */
        private String encryptionKey;
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic name for status events.
         */
        private String statusEventsTopic = "psp-status-events";

        /**
         * Partitions of the status events topic when it is created by this application.
         */
        private int topicPartitions = 3;

        /**
         * Replication factor of the status events topic when it is created by this application.
         */
        private short topicReplicas = 1;

        /**
         * Max number of events per batch.
         */
        private int batchSize = 100;

        /**
         * Fixed delay between publisher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        /**
         * Base backoff used for retries (exponential).
         */
        private Duration baseBackoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(2);
    }
}
