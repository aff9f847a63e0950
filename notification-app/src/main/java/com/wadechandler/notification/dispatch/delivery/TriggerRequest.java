package com.wadechandler.notification.dispatch.delivery;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One trigger call: every recipient of a notification, the channels it should go out on, and its payload.
 */
public record TriggerRequest(
        Long notificationId,
        String workflowKey,
        UUID enterpriseId,
        List<String> recipients,
        List<String> channels,
        Map<String, Object> payload,
        Map<String, Object> overrides
) {
}
