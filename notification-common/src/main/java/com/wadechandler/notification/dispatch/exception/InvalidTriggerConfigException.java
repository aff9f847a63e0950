package com.wadechandler.notification.dispatch.exception;

/**
 * Thrown when a cron rule carries no usable cron expression or time zone.
 */
public class InvalidTriggerConfigException extends RuleEngineException {

    public InvalidTriggerConfigException(String message) {
        super(ErrorCode.INVALID_TRIGGER_CONFIG, message);
    }

    public InvalidTriggerConfigException(String message, Throwable cause) {
        super(ErrorCode.INVALID_TRIGGER_CONFIG, message, cause);
    }
}
