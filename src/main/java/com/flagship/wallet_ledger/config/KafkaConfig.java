package com.flagship.wallet_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic carrying balance and log changes between instances.
 *
 * Keys are account ids, so the partition count bounds how many accounts
 * are relayed in parallel without breaking per-account order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:wallet-ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
