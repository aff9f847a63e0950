package com.wadechandler.notification.dispatch.exception;

public class NoRecipientsException extends RuleEngineException {

    public NoRecipientsException(String message) {
        super(ErrorCode.NO_RECIPIENTS, message);
    }

    public NoRecipientsException(String message, Throwable cause) {
        super(ErrorCode.NO_RECIPIENTS, message, cause);
    }
}
