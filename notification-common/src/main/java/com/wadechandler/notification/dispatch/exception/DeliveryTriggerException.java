package com.wadechandler.notification.dispatch.exception;

/**
 * Thrown by a delivery trigger client when the downstream call fails, times out,
 * or answers without a transaction id.
 */
public class DeliveryTriggerException extends RuleEngineException {

    public DeliveryTriggerException(String message) {
        super(ErrorCode.TRIGGER_FAILURE, message);
    }

    public DeliveryTriggerException(String message, Throwable cause) {
        super(ErrorCode.TRIGGER_FAILURE, message, cause);
    }
}
