package com.wadechandler.notification.dispatch.model.dto;

/**
 * Outcome counts of pushing a set of rules through single-rule sync.
 */
public record SyncStats(int processed, int created, int updated, int unchanged, int deleted, int errors) {

    public static SyncStats empty() {
        return new SyncStats(0, 0, 0, 0, 0, 0);
    }
}
