package com.github.dimitryivaniuta.gateway.smartpay.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Creates the status events topic for local/dev environments; production topics come from IaC.
     *
     * <p>Keyed by merchant order id, so all statuses of one order land on the same partition.</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic statusEventsTopic(AppProperties props) {
        AppProperties.Outbox outbox = props.getOutbox();
        return TopicBuilder.name(outbox.getStatusEventsTopic())
                .partitions(outbox.getTopicPartitions())
                .replicas(outbox.getTopicReplicas())
                .build();
    }
}
