package com.wadechandler.notification.dispatch.repository;

import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.NotificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;

/**
 * Notification persistence. Every status transition is a single conditional UPDATE;
 * a return value of 0 means another writer got there first.
 */
public interface NotificationRepository extends JpaRepository<Notification, Long>, JpaSpecificationExecutor<Notification> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Notification n
               set n.status = :processing, n.attemptCount = n.attemptCount + 1, n.updatedAt = :now
             where n.id = :id and n.status = :expected
            """)
    int claim(@Param("id") Long id,
              @Param("expected") NotificationStatus expected,
              @Param("processing") NotificationStatus processing,
              @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Notification n
               set n.status = :sent, n.transactionId = :transactionId, n.errorDetails = null,
                   n.processedAt = :now, n.updatedAt = :now
             where n.id = :id and n.status = :processing
            """)
    int markSent(@Param("id") Long id,
                 @Param("transactionId") String transactionId,
                 @Param("sent") NotificationStatus sent,
                 @Param("processing") NotificationStatus processing,
                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Notification n
               set n.status = :failed, n.errorDetails = :errorDetails, n.updatedAt = :now
             where n.id = :id and n.status = :processing
            """)
    int markFailed(@Param("id") Long id,
                   @Param("errorDetails") String errorDetails,
                   @Param("failed") NotificationStatus failed,
                   @Param("processing") NotificationStatus processing,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Notification n
               set n.status = :retracted, n.retractedAt = :now, n.retractionReason = :reason, n.updatedAt = :now
             where n.id = :id and n.status in :cancellable
            """)
    int retract(@Param("id") Long id,
                @Param("reason") String reason,
                @Param("retracted") NotificationStatus retracted,
                @Param("cancellable") Collection<NotificationStatus> cancellable,
                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Notification n
               set n.status = :failed, n.errorDetails = :errorDetails, n.updatedAt = :now
             where n.id = :id and n.status = :processing and n.updatedAt < :cutoff
            """)
    int releaseStale(@Param("id") Long id,
                     @Param("cutoff") Instant cutoff,
                     @Param("errorDetails") String errorDetails,
                     @Param("failed") NotificationStatus failed,
                     @Param("processing") NotificationStatus processing,
                     @Param("now") Instant now);
}
