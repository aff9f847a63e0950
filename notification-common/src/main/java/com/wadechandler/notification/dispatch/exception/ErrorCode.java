package com.wadechandler.notification.dispatch.exception;

public enum ErrorCode {
    INVALID_TRIGGER_CONFIG,
    INVALID_INPUT,
    RULE_NOT_FOUND,
    WORKFLOW_NOT_FOUND,
    NO_RECIPIENTS,
    BACKEND_UNAVAILABLE,
    TRIGGER_FAILURE
}
