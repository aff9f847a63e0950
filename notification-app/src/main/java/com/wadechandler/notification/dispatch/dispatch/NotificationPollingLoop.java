package com.wadechandler.notification.dispatch.dispatch;

import com.wadechandler.notification.dispatch.config.DispatcherProperties;
import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.dto.DispatchStats;
import com.wadechandler.notification.dispatch.store.NotificationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * The dispatcher's polls, each on its own fixed-delay schedule:
 * <ul>
 *   <li>new: PENDING rows that are unscheduled or due</li>
 *   <li>scheduled: PENDING rows whose {@code scheduledFor} has passed, earliest first</li>
 *   <li>failed: FAILED rows under the attempt limit, after an initial delay</li>
 *   <li>stale: PROCESSING rows abandoned by a crashed dispatcher go back to FAILED</li>
 * </ul>
 * Stopping cancels future ticks and waits, up to the shutdown timeout, for running ticks to finish.
 */
@Component
@Profile("dispatcher")
@Slf4j
public class NotificationPollingLoop implements SmartLifecycle {

    private final NotificationStore notificationStore;
    private final NotificationDispatcher dispatcher;
    private final DispatcherProperties properties;
    private final TaskScheduler taskScheduler;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
    private final Object tickMonitor = new Object();
    private int activeTicks;
    private volatile boolean running;

    public NotificationPollingLoop(
            NotificationStore notificationStore,
            NotificationDispatcher dispatcher,
            DispatcherProperties properties,
            @Qualifier("notificationPollScheduler") TaskScheduler taskScheduler,
            ObjectMapper objectMapper,
            Clock clock) {
        this.notificationStore = notificationStore;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Instant now = clock.instant();
        tasks.add(taskScheduler.scheduleWithFixedDelay(
                () -> tick("new", this::pollNew), now, properties.getPollInterval()));
        tasks.add(taskScheduler.scheduleWithFixedDelay(
                () -> tick("scheduled", this::pollScheduled), now, properties.getScheduledPollInterval()));
        tasks.add(taskScheduler.scheduleWithFixedDelay(
                () -> tick("failed", this::pollFailed),
                now.plus(properties.getFailedInitialDelay()), properties.getFailedPollInterval()));
        tasks.add(taskScheduler.scheduleWithFixedDelay(
                () -> tick("stale", this::recoverStale), now, properties.getStaleCheckInterval()));
        log.info("Notification polling started (new every {}, scheduled every {}, failed every {} after {})",
                properties.getPollInterval(), properties.getScheduledPollInterval(),
                properties.getFailedPollInterval(), properties.getFailedInitialDelay());
    }

    @Override
    public synchronized void stop() {
        running = false;
        tasks.forEach(task -> task.cancel(false));
        tasks.clear();
        awaitActiveTicks(properties.getShutdownTimeout());
        log.info("Notification polling stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    public DispatchStats pollNew() {
        List<Notification> candidates = notificationStore.findNew(clock.instant(), properties.getBatchSize(),
                properties.getEnterpriseId(), properties.isIncludeProcessed());
        return dispatchBatch("new", candidates);
    }

    public DispatchStats pollScheduled() {
        List<Notification> candidates = notificationStore.findDueScheduled(
                clock.instant(), properties.getBatchSize(), properties.getEnterpriseId());
        return dispatchBatch("scheduled", candidates);
    }

    public DispatchStats pollFailed() {
        List<Notification> candidates = notificationStore.findFailed(
                properties.getBatchSize(), properties.getMaxAttempts(), properties.getEnterpriseId());
        return dispatchBatch("failed", candidates);
    }

    /**
     * @return number of PROCESSING rows moved back to FAILED
     */
    public int recoverStale() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getProcessingTimeout());
        List<Notification> stale = notificationStore.findStaleProcessing(
                cutoff, properties.getBatchSize(), properties.getEnterpriseId());
        int released = 0;
        for (Notification notification : stale) {
            String details = objectMapper.writeValueAsString(Map.of(
                    "error", "Dispatch did not complete within " + properties.getProcessingTimeout(),
                    "type", "PROCESSING_TIMEOUT",
                    "attempt", notification.getAttemptCount(),
                    "timestamp", now.toString()));
            if (notificationStore.releaseStale(notification.getId(), cutoff, details, now)) {
                released++;
                log.warn("Notification {} stuck in PROCESSING since {}, marked FAILED",
                        notification.getId(), notification.getUpdatedAt());
            }
        }
        return released;
    }

    private DispatchStats dispatchBatch(String poll, List<Notification> candidates) {
        if (candidates.isEmpty()) {
            return DispatchStats.empty();
        }
        DispatchStats stats = dispatcher.dispatchAll(candidates);
        log.info("{} poll dispatched {} notification(s): {}", poll, candidates.size(), stats);
        return stats;
    }

    private void tick(String poll, Supplier<?> work) {
        synchronized (tickMonitor) {
            if (!running) {
                return;
            }
            activeTicks++;
        }
        try {
            work.get();
        } catch (Exception e) {
            log.error("Notification {} poll failed, will retry on the next tick", poll, e);
        } finally {
            synchronized (tickMonitor) {
                activeTicks--;
                tickMonitor.notifyAll();
            }
        }
    }

    private void awaitActiveTicks(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (tickMonitor) {
            while (activeTicks > 0) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMillis <= 0) {
                    log.warn("{} notification poll(s) still running after {}", activeTicks, timeout);
                    return;
                }
                try {
                    tickMonitor.wait(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
