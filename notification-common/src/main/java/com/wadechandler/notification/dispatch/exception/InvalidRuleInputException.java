package com.wadechandler.notification.dispatch.exception;

/**
 * Thrown when a fired schedule hands over input that can never produce a notification.
 */
public class InvalidRuleInputException extends RuleEngineException {

    public InvalidRuleInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidRuleInputException(String message, Throwable cause) {
        super(ErrorCode.INVALID_INPUT, message, cause);
    }
}
