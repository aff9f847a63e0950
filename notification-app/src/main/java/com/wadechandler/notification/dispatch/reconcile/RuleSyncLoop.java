package com.wadechandler.notification.dispatch.reconcile;

import com.wadechandler.notification.dispatch.config.ReconcilerProperties;
import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.dto.ReconciliationStats;
import com.wadechandler.notification.dispatch.model.dto.SyncStats;
import com.wadechandler.notification.dispatch.repository.NotificationRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic driver of {@link RuleSyncService}.
 * <ul>
 *   <li>On start: one full reconciliation; the cursor is set to the start instant.</li>
 *   <li>Every poll interval: rules updated after the cursor are synced one by one and the
 *       cursor moves to the latest {@code updatedAt} seen.</li>
 *   <li>Every reconcile interval, and on {@link #forceReconciliation()}: full reconciliation,
 *       which also catches hard deletes and manual edits in the scheduler.</li>
 * </ul>
 * A failing tick is logged and the next tick tries again.
 */
@Component
@Profile("reconciler")
@Slf4j
public class RuleSyncLoop implements SmartLifecycle {

    private final RuleSyncService ruleSyncService;
    private final NotificationRuleRepository ruleRepository;
    private final ReconcilerProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
    private volatile Instant cursor;
    private volatile boolean running;

    public RuleSyncLoop(
            RuleSyncService ruleSyncService,
            NotificationRuleRepository ruleRepository,
            ReconcilerProperties properties,
            @Qualifier("ruleSyncScheduler") TaskScheduler taskScheduler,
            Clock clock) {
        this.ruleSyncService = ruleSyncService;
        this.ruleRepository = ruleRepository;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        Instant now = clock.instant();
        if (cursor == null) {
            cursor = now;
        }
        Instant firstRun = now.plus(properties.getInitialDelay());
        tasks.add(taskScheduler.schedule(() -> tick("initial reconciliation", this::forceReconciliation), firstRun));
        tasks.add(taskScheduler.scheduleWithFixedDelay(
                () -> tick("rule poll", this::pollChanges),
                firstRun.plus(properties.getPollInterval()), properties.getPollInterval()));
        tasks.add(taskScheduler.scheduleWithFixedDelay(
                () -> tick("periodic reconciliation", this::forceReconciliation),
                firstRun.plus(properties.getReconcileInterval()), properties.getReconcileInterval()));
        running = true;
        log.info("Rule sync loop started (poll every {}, reconcile every {}, cursor {})",
                properties.getPollInterval(), properties.getReconcileInterval(), cursor);
    }

    @Override
    public synchronized void stop() {
        tasks.forEach(task -> task.cancel(false));
        tasks.clear();
        running = false;
        log.info("Rule sync loop stopped at cursor {}", cursor);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    /**
     * Sync rules written since the cursor, at most one batch per call.
     */
    public synchronized SyncStats pollChanges() {
        Instant from = cursor != null ? cursor : clock.instant();
        List<NotificationRule> changed = ruleRepository.findChangedSince(
                from, properties.getEnterpriseId(), properties.getBatchSize());
        if (changed.isEmpty()) {
            cursor = from;
            return SyncStats.empty();
        }
        log.debug("Found {} rule(s) changed since {}", changed.size(), from);
        SyncStats stats = ruleSyncService.syncRules(changed);
        cursor = changed.stream()
                .map(NotificationRule::getUpdatedAt)
                .max(Comparator.naturalOrder())
                .filter(latest -> latest.isAfter(from))
                .orElse(from);
        return stats;
    }

    public synchronized ReconciliationStats forceReconciliation() {
        return ruleSyncService.reconcileSchedules(properties.getEnterpriseId());
    }

    public Instant cursor() {
        return cursor;
    }

    public synchronized void resetCursor(Instant newCursor) {
        this.cursor = newCursor;
    }

    private void tick(String name, Runnable work) {
        try {
            work.run();
        } catch (Exception e) {
            log.error("Rule sync {} failed, will retry on the next tick", name, e);
        }
    }
}
