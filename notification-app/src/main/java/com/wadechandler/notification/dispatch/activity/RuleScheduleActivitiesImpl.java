package com.wadechandler.notification.dispatch.activity;

import com.wadechandler.notification.dispatch.exception.InvalidRuleInputException;
import com.wadechandler.notification.dispatch.exception.RuleNotFoundException;
import com.wadechandler.notification.dispatch.exception.WorkflowNotFoundException;
import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.NotificationChannel;
import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.NotificationStatus;
import com.wadechandler.notification.dispatch.model.NotificationWorkflowDefinition;
import com.wadechandler.notification.dispatch.model.PublishStatus;
import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;
import com.wadechandler.notification.dispatch.repository.NotificationRuleRepository;
import com.wadechandler.notification.dispatch.repository.NotificationWorkflowDefinitionRepository;
import com.wadechandler.notification.dispatch.rule.RecipientExtractor;
import com.wadechandler.notification.dispatch.store.NotificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Activity implementation backed by the notification tables. This is a Spring-managed bean.
 */
@Component
@Profile("schedule-worker")
@RequiredArgsConstructor
@Slf4j
public class RuleScheduleActivitiesImpl implements RuleScheduleActivities {

    private final NotificationRuleRepository ruleRepository;
    private final NotificationWorkflowDefinitionRepository workflowRepository;
    private final NotificationStore notificationStore;

    @Override
    public Long createNotificationFromRule(RuleScheduledInput input) {
        log.info("Creating notification from scheduled rule {} (enterprise {}, workflow {})",
                input.ruleId(), input.enterpriseId(), input.workflowId());

        if (input.enterpriseId() == null) {
            throw new InvalidRuleInputException("Enterprise id is required for rule " + input.ruleId());
        }

        NotificationRule rule = ruleRepository.findByIdAndEnterpriseId(input.ruleId(), input.enterpriseId())
                .orElseThrow(() -> new RuleNotFoundException("Rule not found: " + input.ruleId()));

        if (rule.isDeactivated() || rule.getPublishStatus() != PublishStatus.PUBLISH) {
            log.warn("Skipping notification for inactive rule {} (deactivated={}, publishStatus={})",
                    rule.getId(), rule.isDeactivated(), rule.getPublishStatus());
            return null;
        }

        NotificationWorkflowDefinition workflow = workflowRepository.findPublished(input.workflowId(), input.enterpriseId())
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow not found: " + input.workflowId()));

        Map<String, Object> payload = input.rulePayload() != null ? input.rulePayload() : Map.of();
        List<String> recipients = RecipientExtractor.extract(payload);

        Notification notification = Notification.builder()
                .enterpriseId(input.enterpriseId())
                .businessId(input.businessId())
                .notificationWorkflowId(workflow.getId())
                .notificationRuleId(rule.getId())
                .name("Scheduled: " + rule.getName())
                .description("Notification triggered by scheduled rule: " + rule.getName())
                .payload(new HashMap<>(payload))
                .recipients(new ArrayList<>(recipients))
                .channels(defaultChannels(workflow))
                .status(NotificationStatus.PENDING)
                .build();

        Notification saved = notificationStore.insert(notification);
        log.info("Created notification {} from rule {} for {} recipient(s)",
                saved.getId(), rule.getId(), recipients.size());
        return saved.getId();
    }

    private static List<String> defaultChannels(NotificationWorkflowDefinition workflow) {
        List<String> channels = workflow.getDefaultChannels();
        if (channels == null || channels.isEmpty()) {
            return new ArrayList<>(List.of(NotificationChannel.IN_APP.name()));
        }
        return new ArrayList<>(channels);
    }
}
