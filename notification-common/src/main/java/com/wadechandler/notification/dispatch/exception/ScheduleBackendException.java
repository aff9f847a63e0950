package com.wadechandler.notification.dispatch.exception;

/**
 * Thrown when the scheduling backend cannot be reached or rejects a call for a transient reason.
 */
public class ScheduleBackendException extends RuleEngineException {

    public ScheduleBackendException(String message) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message);
    }

    public ScheduleBackendException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }
}
