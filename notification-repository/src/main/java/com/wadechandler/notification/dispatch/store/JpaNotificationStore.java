package com.wadechandler.notification.dispatch.store;

import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.NotificationStatus;
import com.wadechandler.notification.dispatch.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaNotificationStore implements NotificationStore {

    private static final Sort BY_UPDATED = Sort.by("updatedAt", "id");
    private static final Sort BY_DUE = Sort.by("scheduledFor", "id");

    private final NotificationRepository notificationRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findNew(Instant now, int batchSize, UUID enterpriseId, boolean includeProcessed) {
        Specification<Notification> spec = unscheduledOrDue(now).and(forEnterprise(enterpriseId));
        if (!includeProcessed) {
            spec = spec.and(hasStatus(NotificationStatus.PENDING));
        }
        return notificationRepository.findAll(spec, PageRequest.of(0, batchSize, BY_UPDATED)).getContent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findDueScheduled(Instant now, int batchSize, UUID enterpriseId) {
        Specification<Notification> spec = hasStatus(NotificationStatus.PENDING)
                .and(scheduledNoLaterThan(now))
                .and(forEnterprise(enterpriseId));
        return notificationRepository.findAll(spec, PageRequest.of(0, batchSize, BY_DUE)).getContent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findFailed(int batchSize, int maxAttempts, UUID enterpriseId) {
        Specification<Notification> spec = hasStatus(NotificationStatus.FAILED)
                .and(attemptsBelow(maxAttempts))
                .and(forEnterprise(enterpriseId));
        return notificationRepository.findAll(spec, PageRequest.of(0, batchSize, BY_UPDATED)).getContent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findStaleProcessing(Instant cutoff, int batchSize, UUID enterpriseId) {
        Specification<Notification> spec = hasStatus(NotificationStatus.PROCESSING)
                .and(updatedBefore(cutoff))
                .and(forEnterprise(enterpriseId));
        return notificationRepository.findAll(spec, PageRequest.of(0, batchSize, BY_UPDATED)).getContent();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Notification> findById(Long id) {
        return notificationRepository.findById(id);
    }

    @Override
    @Transactional
    public Notification insert(Notification notification) {
        return notificationRepository.save(notification);
    }

    @Override
    @Transactional
    public boolean claim(Long id, NotificationStatus expected, Instant now) {
        return notificationRepository.claim(id, expected, NotificationStatus.PROCESSING, now) == 1;
    }

    @Override
    @Transactional
    public boolean markSent(Long id, String transactionId, Instant now) {
        return notificationRepository.markSent(
                id, transactionId, NotificationStatus.SENT, NotificationStatus.PROCESSING, now) == 1;
    }

    @Override
    @Transactional
    public boolean markFailed(Long id, String errorDetails, Instant now) {
        return notificationRepository.markFailed(
                id, errorDetails, NotificationStatus.FAILED, NotificationStatus.PROCESSING, now) == 1;
    }

    @Override
    @Transactional
    public boolean retract(Long id, String reason, Instant now) {
        return notificationRepository.retract(id, reason, NotificationStatus.RETRACTED,
                EnumSet.of(NotificationStatus.PENDING, NotificationStatus.FAILED), now) == 1;
    }

    @Override
    @Transactional
    public boolean releaseStale(Long id, Instant cutoff, String errorDetails, Instant now) {
        return notificationRepository.releaseStale(
                id, cutoff, errorDetails, NotificationStatus.FAILED, NotificationStatus.PROCESSING, now) == 1;
    }

    private static Specification<Notification> hasStatus(NotificationStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    private static Specification<Notification> unscheduledOrDue(Instant now) {
        return (root, query, cb) -> cb.or(
                cb.isNull(root.get("scheduledFor")),
                cb.lessThanOrEqualTo(root.<Instant>get("scheduledFor"), now));
    }

    private static Specification<Notification> scheduledNoLaterThan(Instant now) {
        return (root, query, cb) -> cb.and(
                cb.isNotNull(root.get("scheduledFor")),
                cb.lessThanOrEqualTo(root.<Instant>get("scheduledFor"), now));
    }

    private static Specification<Notification> attemptsBelow(int maxAttempts) {
        return (root, query, cb) -> cb.lessThan(root.<Integer>get("attemptCount"), maxAttempts);
    }

    private static Specification<Notification> updatedBefore(Instant cutoff) {
        return (root, query, cb) -> cb.lessThan(root.<Instant>get("updatedAt"), cutoff);
    }

    private static Specification<Notification> forEnterprise(UUID enterpriseId) {
        return (root, query, cb) -> enterpriseId == null
                ? cb.conjunction()
                : cb.equal(root.get("enterpriseId"), enterpriseId);
    }
}
