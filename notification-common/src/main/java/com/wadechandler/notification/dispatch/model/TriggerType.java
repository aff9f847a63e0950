package com.wadechandler.notification.dispatch.model;

public enum TriggerType {
    CRON,
    EVENT
}
