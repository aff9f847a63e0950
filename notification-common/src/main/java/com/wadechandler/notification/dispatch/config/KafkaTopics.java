package com.wadechandler.notification.dispatch.config;

/**
 * Kafka topic name constants shared across all modules.
 * Kept out of the messaging module so that consumers can reference topic names
 * without depending on Spring Kafka's {@code NewTopic} bean definitions.
 */
public final class KafkaTopics {

    public static final String RULE_EVENTS_TOPIC = "notification-rule-events";
    public static final String NOTIFICATION_STATUS_EVENTS_TOPIC = "notification-status-events";

    private KafkaTopics() {
        // constants only
    }
}
