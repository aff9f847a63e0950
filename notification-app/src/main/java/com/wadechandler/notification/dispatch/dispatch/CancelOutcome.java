package com.wadechandler.notification.dispatch.dispatch;

public enum CancelOutcome {
    RETRACTED,
    /** Currently claimed by a dispatcher; only the owner may move it. */
    IN_FLIGHT,
    ALREADY_FINAL,
    NOT_FOUND
}
