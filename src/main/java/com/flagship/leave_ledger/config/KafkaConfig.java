package com.flagship.leave_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Duration;

/**
 * Declares the leave-events topic. Records are keyed by aggregate id, so any
 * partition count keeps the transitions of one request in order.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic leaveEventsTopic(@Value("${kafka.topic.leave-events:leave-events}") String name,
                                     @Value("${kafka.topic.partitions:3}") int partitions,
                                     @Value("${kafka.topic.replicas:1}") int replicas,
                                     @Value("${kafka.topic.retention:14d}") Duration retention) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retention.toMillis()))
                .build();
    }
}
