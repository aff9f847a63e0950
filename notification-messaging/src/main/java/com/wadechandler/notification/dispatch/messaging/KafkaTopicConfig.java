package com.wadechandler.notification.dispatch.messaging;

import com.wadechandler.notification.dispatch.config.KafkaTopics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic auto-creation beans. These ensure the required topics exist
 * when the application starts and a Kafka AdminClient is available.
 * <p>
 * The schedule-worker profile talks only to Temporal and the database, so it does not create topics.
 */
@Configuration
@Profile({"reconciler", "dispatcher"})
public class KafkaTopicConfig {

    @Bean
    public NewTopic ruleEventsTopic() {
        return TopicBuilder.name(KafkaTopics.RULE_EVENTS_TOPIC).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic notificationStatusEventsTopic() {
        return TopicBuilder.name(KafkaTopics.NOTIFICATION_STATUS_EVENTS_TOPIC).partitions(3).replicas(1).build();
    }
}
