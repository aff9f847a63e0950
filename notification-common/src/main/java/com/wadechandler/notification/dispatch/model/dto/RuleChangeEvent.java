package com.wadechandler.notification.dispatch.model.dto;

import java.util.UUID;

/**
 * Message on the rule events topic, emitted when a rule is written or hard-deleted.
 */
public record RuleChangeEvent(
        Long ruleId,
        UUID enterpriseId,
        ChangeType changeType
) {

    public enum ChangeType {
        UPSERT,
        DELETE
    }
}
