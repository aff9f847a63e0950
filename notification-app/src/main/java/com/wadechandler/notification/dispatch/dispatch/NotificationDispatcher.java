package com.wadechandler.notification.dispatch.dispatch;

import com.wadechandler.notification.dispatch.delivery.DeliveryTriggerClient;
import com.wadechandler.notification.dispatch.delivery.TriggerRequest;
import com.wadechandler.notification.dispatch.exception.RuleEngineException;
import com.wadechandler.notification.dispatch.exception.WorkflowNotFoundException;
import com.wadechandler.notification.dispatch.messaging.NotificationStatusPublisher;
import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.NotificationStatus;
import com.wadechandler.notification.dispatch.model.NotificationWorkflowDefinition;
import com.wadechandler.notification.dispatch.model.dto.DispatchStats;
import com.wadechandler.notification.dispatch.model.dto.NotificationStatusEvent;
import com.wadechandler.notification.dispatch.repository.NotificationWorkflowDefinitionRepository;
import com.wadechandler.notification.dispatch.store.NotificationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Claim, trigger, record. A notification is only ever triggered by the dispatcher whose
 * conditional claim moved it to PROCESSING, so replicas may poll the same rows safely.
 */
@Component
@Profile("dispatcher")
@Slf4j
public class NotificationDispatcher {

    private final NotificationStore notificationStore;
    private final NotificationWorkflowDefinitionRepository workflowRepository;
    private final DeliveryTriggerClient triggerClient;
    private final NotificationStatusPublisher statusPublisher;
    private final ObjectMapper objectMapper;
    private final Executor dispatchExecutor;
    private final Clock clock;

    public NotificationDispatcher(
            NotificationStore notificationStore,
            NotificationWorkflowDefinitionRepository workflowRepository,
            DeliveryTriggerClient triggerClient,
            NotificationStatusPublisher statusPublisher,
            ObjectMapper objectMapper,
            @Qualifier("dispatchExecutor") Executor dispatchExecutor,
            Clock clock) {
        this.notificationStore = notificationStore;
        this.workflowRepository = workflowRepository;
        this.triggerClient = triggerClient;
        this.statusPublisher = statusPublisher;
        this.objectMapper = objectMapper;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    /**
     * Dispatch one notification whose status was read as {@code notification.getStatus()}.
     */
    public DispatchOutcome dispatch(Notification notification) {
        Long id = notification.getId();
        NotificationStatus expected = notification.getStatus();
        if (expected == null || !expected.isClaimable()) {
            log.debug("Notification {} is {}, not dispatchable", id, expected);
            return DispatchOutcome.SKIPPED;
        }
        if (!notificationStore.claim(id, expected, clock.instant())) {
            log.debug("Notification {} was claimed elsewhere", id);
            return DispatchOutcome.SKIPPED;
        }

        int attempt = notification.getAttemptCount() + 1;
        String transactionId;
        try {
            NotificationWorkflowDefinition workflow = workflowRepository
                    .findPublished(notification.getNotificationWorkflowId(), notification.getEnterpriseId())
                    .orElseThrow(() -> new WorkflowNotFoundException(
                            "Workflow not found: " + notification.getNotificationWorkflowId()));
            transactionId = triggerClient.trigger(new TriggerRequest(
                    id,
                    workflow.getWorkflowKey(),
                    notification.getEnterpriseId(),
                    notification.getRecipients(),
                    notification.getChannels(),
                    notification.getPayload(),
                    notification.getOverrides()));
        } catch (Exception e) {
            return recordFailure(notification, attempt, e) ? DispatchOutcome.FAILED : DispatchOutcome.SKIPPED;
        }

        if (!notificationStore.markSent(id, transactionId, clock.instant())) {
            log.warn("Notification {} was moved out of PROCESSING before SENT could be recorded (transaction {})",
                    id, transactionId);
            return DispatchOutcome.SKIPPED;
        }
        log.info("Notification {} sent (attempt {}, transaction {})", id, attempt, transactionId);
        publish(notification, NotificationStatus.SENT, transactionId, null);
        return DispatchOutcome.SENT;
    }

    /**
     * Dispatch a batch with at most as many concurrent triggers as the dispatch executor has threads.
     * Returns once every item has an outcome; one item's failure never affects the others.
     */
    public DispatchStats dispatchAll(List<Notification> candidates) {
        if (candidates.isEmpty()) {
            return DispatchStats.empty();
        }
        List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>(candidates.size());
        for (Notification notification : candidates) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> dispatchSafely(notification), dispatchExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("Dispatch executor rejected notification {}, leaving it for the next poll", notification.getId());
                futures.add(CompletableFuture.completedFuture(DispatchOutcome.SKIPPED));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int sent = 0;
        int failed = 0;
        int skipped = 0;
        for (CompletableFuture<DispatchOutcome> future : futures) {
            switch (future.join()) {
                case SENT -> sent++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new DispatchStats(candidates.size(), sent, failed, skipped);
    }

    /**
     * Retract a PENDING or FAILED notification. A PROCESSING row is left to its owner.
     */
    public CancelOutcome cancelNotification(Long id, String reason) {
        Optional<Notification> current = notificationStore.findById(id);
        if (current.isEmpty()) {
            return CancelOutcome.NOT_FOUND;
        }
        if (notificationStore.retract(id, reason, clock.instant())) {
            log.info("Notification {} retracted: {}", id, reason);
            publish(current.get(), NotificationStatus.RETRACTED, null, reason);
            return CancelOutcome.RETRACTED;
        }
        NotificationStatus status = notificationStore.findById(id)
                .map(Notification::getStatus)
                .orElse(current.get().getStatus());
        return status == NotificationStatus.PROCESSING ? CancelOutcome.IN_FLIGHT : CancelOutcome.ALREADY_FINAL;
    }

    private DispatchOutcome dispatchSafely(Notification notification) {
        try {
            return dispatch(notification);
        } catch (RuntimeException e) {
            // Store failure around the claim or the outcome update; a claimed row is picked up by stale recovery.
            log.error("Dispatch of notification {} aborted", notification.getId(), e);
            return DispatchOutcome.FAILED;
        }
    }

    /**
     * @return false if the row had already left PROCESSING, so this attempt's outcome was not recorded
     */
    private boolean recordFailure(Notification notification, int attempt, Exception error) {
        Long id = notification.getId();
        String details = errorDetails(error, attempt);
        if (!notificationStore.markFailed(id, details, clock.instant())) {
            log.warn("Notification {} was moved out of PROCESSING before FAILED could be recorded", id);
            return false;
        }
        log.warn("Notification {} failed (attempt {}): {}", id, attempt, error.getMessage());
        publish(notification, NotificationStatus.FAILED, null, error.getMessage());
        return true;
    }

    String errorDetails(Exception error, int attempt) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        details.put("type", error instanceof RuleEngineException ree ? ree.getCode().name() : error.getClass().getSimpleName());
        details.put("attempt", attempt);
        details.put("timestamp", clock.instant().toString());
        return objectMapper.writeValueAsString(details);
    }

    private void publish(Notification notification, NotificationStatus status, String transactionId, String error) {
        statusPublisher.publish(new NotificationStatusEvent(
                notification.getId(), notification.getEnterpriseId(), status, transactionId, error, clock.instant()));
    }
}
