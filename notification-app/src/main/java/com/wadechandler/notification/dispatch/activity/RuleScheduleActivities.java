package com.wadechandler.notification.dispatch.activity;

import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;
import io.temporal.activity.ActivityInterface;

@ActivityInterface
public interface RuleScheduleActivities {

    /**
     * Insert a PENDING notification for a fired rule.
     *
     * @return the new notification id, or null when the rule is no longer active
     */
    Long createNotificationFromRule(RuleScheduledInput input);
}
