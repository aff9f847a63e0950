package com.wadechandler.notification.dispatch.reconcile;

/**
 * What single-rule sync did to the rule's schedule.
 */
public enum SyncAction {
    CREATED,
    UPDATED,
    UNCHANGED,
    DELETED,
    /** The rule should have no schedule and had none. */
    ABSENT
}
