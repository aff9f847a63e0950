package com.wadechandler.notification.dispatch.model;

public enum PublishStatus {
    DRAFT,
    PUBLISH
}
