package com.wadechandler.notification.dispatch.store;

import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.NotificationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Notification queries and compare-and-set transitions used by the dispatcher.
 * Every {@code boolean} method reports whether the row was in the expected state
 * and has been moved; {@code false} is a normal outcome under concurrency.
 * A null {@code enterpriseId} means all enterprises.
 */
public interface NotificationStore {

    /**
     * PENDING rows that are unscheduled or already due, oldest update first.
     * With {@code includeProcessed} the status filter is dropped.
     */
    List<Notification> findNew(Instant now, int batchSize, UUID enterpriseId, boolean includeProcessed);

    /**
     * PENDING rows whose {@code scheduledFor} has passed, earliest due first.
     */
    List<Notification> findDueScheduled(Instant now, int batchSize, UUID enterpriseId);

    /**
     * FAILED rows that have been claimed fewer than {@code maxAttempts} times, oldest update first.
     */
    List<Notification> findFailed(int batchSize, int maxAttempts, UUID enterpriseId);

    /**
     * PROCESSING rows not touched since {@code cutoff}.
     */
    List<Notification> findStaleProcessing(Instant cutoff, int batchSize, UUID enterpriseId);

    Optional<Notification> findById(Long id);

    Notification insert(Notification notification);

    boolean claim(Long id, NotificationStatus expected, Instant now);

    boolean markSent(Long id, String transactionId, Instant now);

    boolean markFailed(Long id, String errorDetails, Instant now);

    /**
     * PENDING or FAILED to RETRACTED.
     */
    boolean retract(Long id, String reason, Instant now);

    /**
     * PROCESSING to FAILED, only while the row is still older than {@code cutoff}.
     */
    boolean releaseStale(Long id, Instant cutoff, String errorDetails, Instant now);
}
