package com.flagship.celebration_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Inbound topics: payment provider settlement events and lifecycle triggers
 * from condition watchers. Keyed by celebration ID so events for one
 * celebration stay ordered within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlements:celebration-settlements}")
    private String settlementsTopic;

    @Value("${kafka.topic.lifecycle:celebration-lifecycle}")
    private String lifecycleTopic;

    @Bean
    public NewTopic settlementsTopic() {
        return TopicBuilder.name(settlementsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic lifecycleTopic() {
        return TopicBuilder.name(lifecycleTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
