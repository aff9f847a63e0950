package com.wadechandler.notification.dispatch.messaging;

import com.wadechandler.notification.dispatch.config.KafkaTopics;
import com.wadechandler.notification.dispatch.model.dto.NotificationStatusEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Publishes terminal notification outcomes to {@code notification-status-events}, keyed by notification id.
 * Publishing is best-effort: the database row is the record of truth, so a failed send is logged and dropped.
 */
@Component
@Profile("dispatcher")
@RequiredArgsConstructor
@Slf4j
public class NotificationStatusPublisher {

    private final ObjectMapper objectMapper;
    private final KafkaTemplate<String, String> kafkaTemplate;

    public void publish(NotificationStatusEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(KafkaTopics.NOTIFICATION_STATUS_EVENTS_TOPIC, String.valueOf(event.notificationId()), json)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish status {} for notification {}",
                                    event.status(), event.notificationId(), ex);
                        }
                    });
        } catch (Exception e) {
            log.warn("Failed to publish status {} for notification {}", event.status(), event.notificationId(), e);
        }
    }
}
