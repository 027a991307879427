package com.flagship.budget_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.rollover-updates:rollover-updates}")
    private String rolloverUpdatesTopic;

    /**
     * Rollover events are keyed by budget id, so one budget's updates stay
     * ordered within a partition.
     */
    @Bean
    public NewTopic rolloverUpdatesTopic() {
        return TopicBuilder.name(rolloverUpdatesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
