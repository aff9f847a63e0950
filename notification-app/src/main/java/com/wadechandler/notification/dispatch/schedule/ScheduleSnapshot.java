package com.wadechandler.notification.dispatch.schedule;

import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;

import java.util.Optional;
import java.util.UUID;

/**
 * A schedule as reported by the scheduling backend. {@code calendar} is null when the backend
 * only returned a listing entry, or when the schedule is not a single calendar spec.
 * {@code ruleId} and {@code enterpriseId} come from the schedule memo and may be absent.
 * {@code actionHash} is {@link ScheduleDefinition#actionHash(String, RuleScheduledInput)} of the
 * schedule's note and workflow argument, null when unknown.
 */
public record ScheduleSnapshot(
        String scheduleId,
        Long ruleId,
        String enterpriseId,
        CronCalendar calendar,
        String timezone,
        boolean paused,
        String actionHash
) {

    /**
     * Rule-owned schedules carry a rule id in their memo or follow the rule id format.
     * Anything else in the namespace belongs to someone else and is never touched.
     */
    public boolean isRuleOwned() {
        return ruleId != null || ScheduleIds.parse(scheduleId).isPresent();
    }

    public boolean belongsTo(UUID enterpriseId) {
        if (enterpriseId == null) {
            return true;
        }
        if (this.enterpriseId != null) {
            return enterpriseId.toString().equals(this.enterpriseId);
        }
        Optional<ScheduleIds.Key> key = ScheduleIds.parse(scheduleId);
        return key.isPresent() && enterpriseId.equals(key.get().enterpriseId());
    }
}
