package com.wadechandler.notification.dispatch.model;

public enum NotificationChannel {
    IN_APP,
    EMAIL,
    SMS,
    CHAT,
    PUSH
}
