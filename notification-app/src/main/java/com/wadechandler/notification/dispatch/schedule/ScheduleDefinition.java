package com.wadechandler.notification.dispatch.schedule;

import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The schedule a rule should have in the scheduling backend.
 */
public record ScheduleDefinition(
        String scheduleId,
        Long ruleId,
        UUID enterpriseId,
        String ruleName,
        CronCalendar calendar,
        String timezone,
        boolean paused,
        RuleScheduledInput action
) {

    /**
     * @throws com.wadechandler.notification.dispatch.exception.InvalidTriggerConfigException
     *         when the rule's trigger config has no usable cron expression or time zone
     */
    public static ScheduleDefinition forRule(NotificationRule rule) {
        CronTrigger trigger = CronTrigger.from(rule.getTriggerConfig());
        Map<String, Object> payload = rule.getRulePayload() != null ? new HashMap<>(rule.getRulePayload()) : Map.of();
        return new ScheduleDefinition(
                ScheduleIds.of(rule.getId(), rule.getEnterpriseId()),
                rule.getId(),
                rule.getEnterpriseId(),
                rule.getName(),
                trigger.calendar(),
                trigger.timezone(),
                !rule.isActiveCron(),
                new RuleScheduledInput(
                        rule.getId(),
                        rule.getEnterpriseId(),
                        rule.getBusinessId(),
                        rule.getNotificationWorkflowId(),
                        payload));
    }

    public String note() {
        return "Notification rule: " + ruleName;
    }

    /**
     * Whether an existing schedule already fires at the same times, in the same state, with the
     * same note and workflow input.
     */
    public boolean matches(ScheduleSnapshot snapshot) {
        return calendar.sameAs(snapshot.calendar())
                && Objects.equals(timezone, snapshot.timezone())
                && paused == snapshot.paused()
                && actionHash().equals(snapshot.actionHash());
    }

    public String actionHash() {
        return actionHash(note(), action);
    }

    /**
     * SHA-256 over a schedule note and its action input. Map keys are sorted so the value does not
     * depend on map iteration order.
     */
    public static String actionHash(String note, RuleScheduledInput input) {
        String canonical = canonical(note) + "|" + canonical(input.ruleId()) + "|" + canonical(input.enterpriseId())
                + "|" + canonical(input.businessId()) + "|" + canonical(input.workflowId())
                + "|" + canonical(input.rulePayload());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, String> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted.entrySet().stream()
                    .map(e -> canonical(e.getKey()) + ":" + e.getValue())
                    .collect(Collectors.joining(",", "{", "}"));
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(ScheduleDefinition::canonical).collect(Collectors.joining(",", "[", "]"));
        }
        if (value instanceof String text) {
            return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return String.valueOf(value);
    }
}
