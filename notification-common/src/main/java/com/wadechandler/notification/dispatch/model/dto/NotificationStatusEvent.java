package com.wadechandler.notification.dispatch.model.dto;

import com.wadechandler.notification.dispatch.model.NotificationStatus;

import java.time.Instant;
import java.util.UUID;

public record NotificationStatusEvent(
        Long notificationId,
        UUID enterpriseId,
        NotificationStatus status,
        String transactionId,
        String error,
        Instant occurredAt
) {
}
