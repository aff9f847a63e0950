package com.wadechandler.notification.dispatch.consumer;

import com.wadechandler.notification.dispatch.config.KafkaTopics;
import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.dto.RuleChangeEvent;
import com.wadechandler.notification.dispatch.reconcile.RuleSyncService;
import com.wadechandler.notification.dispatch.reconcile.SyncAction;
import com.wadechandler.notification.dispatch.repository.NotificationRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Kafka consumer on the {@code notification-rule-events} topic. Applies single-rule changes
 * without waiting for the next poll, including hard deletes that the {@code updated_at} scan
 * cannot see.
 */
@Component
@Profile("reconciler")
@RequiredArgsConstructor
@Slf4j
public class RuleChangeEventConsumer {

    private final ObjectMapper objectMapper;
    private final NotificationRuleRepository ruleRepository;
    private final RuleSyncService ruleSyncService;

    @KafkaListener(topics = KafkaTopics.RULE_EVENTS_TOPIC, groupId = "notification-rule-sync")
    public void consume(ConsumerRecord<String, String> record) {
        RuleChangeEvent event = parse(record);
        if (event == null) {
            return;
        }

        try {
            if (event.changeType() == RuleChangeEvent.ChangeType.DELETE) {
                boolean deleted = ruleSyncService.removeSchedule(event.ruleId(), event.enterpriseId());
                log.info("Rule {} deleted, schedule {}", event.ruleId(), deleted ? "removed" : "already absent");
                return;
            }

            Optional<NotificationRule> rule = ruleRepository.findById(event.ruleId());
            if (rule.isEmpty()) {
                ruleSyncService.removeSchedule(event.ruleId(), event.enterpriseId());
                log.info("Rule {} no longer exists, removed its schedule", event.ruleId());
                return;
            }
            SyncAction action = ruleSyncService.syncRule(rule.get());
            log.info("Rule {} change applied: {}", event.ruleId(), action);
        } catch (Exception e) {
            // The periodic reconciliation repairs whatever this failed to apply.
            log.error("Failed to apply change for rule {} at offset {} partition {}",
                    event.ruleId(), record.offset(), record.partition(), e);
        }
    }

    RuleChangeEvent parse(ConsumerRecord<String, String> record) {
        try {
            RuleChangeEvent event = objectMapper.readValue(record.value(), RuleChangeEvent.class);
            if (event.ruleId() == null) {
                log.warn("Rule change event without ruleId at offset {} partition {}. Skipping.",
                        record.offset(), record.partition());
                return null;
            }
            return event.changeType() == null
                    ? new RuleChangeEvent(event.ruleId(), event.enterpriseId(), RuleChangeEvent.ChangeType.UPSERT)
                    : event;
        } catch (Exception e) {
            log.error("Malformed rule change event at offset {} partition {}. Skipping.",
                    record.offset(), record.partition(), e);
            return null;
        }
    }
}
