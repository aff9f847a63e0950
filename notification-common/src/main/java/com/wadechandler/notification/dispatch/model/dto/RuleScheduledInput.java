package com.wadechandler.notification.dispatch.model.dto;

import java.util.Map;
import java.util.UUID;

/**
 * Arguments a rule schedule passes to the workflow it starts each time it fires.
 */
public record RuleScheduledInput(
        Long ruleId,
        UUID enterpriseId,
        UUID businessId,
        Long workflowId,
        Map<String, Object> rulePayload
) {
}
