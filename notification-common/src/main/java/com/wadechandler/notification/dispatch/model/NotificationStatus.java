package com.wadechandler.notification.dispatch.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a notification row.
 * <pre>
 * PENDING ──claim──▶ PROCESSING ──ok──▶ SENT
 *    │                   └──err──▶ FAILED ──claim──▶ PROCESSING
 *    └──cancel──▶ RETRACTED ◀──cancel── FAILED
 * </pre>
 */
public enum NotificationStatus {
    PENDING,
    PROCESSING,
    SENT,
    FAILED,
    RETRACTED;

    private static final Set<NotificationStatus> CLAIMABLE = EnumSet.of(PENDING, FAILED);

    public boolean isClaimable() {
        return CLAIMABLE.contains(this);
    }

    public boolean isFinal() {
        return this == SENT || this == RETRACTED;
    }
}
