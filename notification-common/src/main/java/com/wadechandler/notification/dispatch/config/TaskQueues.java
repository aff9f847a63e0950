package com.wadechandler.notification.dispatch.config;

/**
 * Temporal task queue name constants shared across all modules.
 * <p>
 * {@code RULE_SCHEDULE_QUEUE} carries both the workflow started by a fired rule
 * schedule and its notification-creation activity.
 */
public final class TaskQueues {

    public static final String RULE_SCHEDULE_QUEUE = "RULE_SCHEDULE_QUEUE";

    private TaskQueues() {
        // constants only
    }
}
