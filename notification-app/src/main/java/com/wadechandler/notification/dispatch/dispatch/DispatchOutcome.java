package com.wadechandler.notification.dispatch.dispatch;

public enum DispatchOutcome {
    SENT,
    FAILED,
    /** The row was not claimable, or this dispatcher lost it before recording a result. */
    SKIPPED
}
