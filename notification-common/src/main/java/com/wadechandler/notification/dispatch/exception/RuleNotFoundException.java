package com.wadechandler.notification.dispatch.exception;

public class RuleNotFoundException extends RuleEngineException {

    public RuleNotFoundException(String message) {
        super(ErrorCode.RULE_NOT_FOUND, message);
    }

    public RuleNotFoundException(String message, Throwable cause) {
        super(ErrorCode.RULE_NOT_FOUND, message, cause);
    }
}
