package com.wadechandler.notification.dispatch.model.dto;

/**
 * Outcome counts of a full diff between active rules and existing schedules.
 */
public record ReconciliationStats(int created, int updated, int unchanged, int deleted, int errors) {
}
