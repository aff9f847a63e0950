package com.wadechandler.notification.dispatch.exception;

/**
 * Thrown when the notification workflow a rule or notification points at is missing,
 * unpublished or deactivated.
 */
public class WorkflowNotFoundException extends RuleEngineException {

    public WorkflowNotFoundException(String message) {
        super(ErrorCode.WORKFLOW_NOT_FOUND, message);
    }

    public WorkflowNotFoundException(String message, Throwable cause) {
        super(ErrorCode.WORKFLOW_NOT_FOUND, message, cause);
    }
}
