package com.wadechandler.notification.dispatch.exception;

import lombok.Getter;

/**
 * Base type for failures raised while scheduling or dispatching notifications.
 * The {@link ErrorCode} is what callers branch on and what gets recorded on failed rows.
 */
@Getter
public class RuleEngineException extends RuntimeException {

    private final ErrorCode code;

    public RuleEngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RuleEngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
