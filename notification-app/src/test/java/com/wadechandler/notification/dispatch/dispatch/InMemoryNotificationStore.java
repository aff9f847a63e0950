package com.wadechandler.notification.dispatch.dispatch;

import com.wadechandler.notification.dispatch.model.Notification;
import com.wadechandler.notification.dispatch.model.NotificationStatus;
import com.wadechandler.notification.dispatch.store.NotificationStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Notification store with the same compare-and-set semantics as the JPA store. Rows are
 * copied in and out so callers never share state with the store.
 */
public class InMemoryNotificationStore implements NotificationStore {

    private final Map<Long, Notification> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public List<Notification> findNew(Instant now, int batchSize, UUID enterpriseId, boolean includeProcessed) {
        return select(n -> (includeProcessed || n.getStatus() == NotificationStatus.PENDING)
                        && (n.getScheduledFor() == null || !n.getScheduledFor().isAfter(now))
                        && matches(enterpriseId, n),
                Comparator.comparing(Notification::getUpdatedAt).thenComparing(Notification::getId), batchSize);
    }

    @Override
    public List<Notification> findDueScheduled(Instant now, int batchSize, UUID enterpriseId) {
        return select(n -> n.getStatus() == NotificationStatus.PENDING
                        && n.getScheduledFor() != null && !n.getScheduledFor().isAfter(now)
                        && matches(enterpriseId, n),
                Comparator.comparing(Notification::getScheduledFor).thenComparing(Notification::getId), batchSize);
    }

    @Override
    public List<Notification> findFailed(int batchSize, int maxAttempts, UUID enterpriseId) {
        return select(n -> n.getStatus() == NotificationStatus.FAILED
                        && n.getAttemptCount() < maxAttempts
                        && matches(enterpriseId, n),
                Comparator.comparing(Notification::getUpdatedAt).thenComparing(Notification::getId), batchSize);
    }

    @Override
    public List<Notification> findStaleProcessing(Instant cutoff, int batchSize, UUID enterpriseId) {
        return select(n -> n.getStatus() == NotificationStatus.PROCESSING
                        && n.getUpdatedAt().isBefore(cutoff)
                        && matches(enterpriseId, n),
                Comparator.comparing(Notification::getUpdatedAt).thenComparing(Notification::getId), batchSize);
    }

    @Override
    public Optional<Notification> findById(Long id) {
        return Optional.ofNullable(rows.get(id)).map(InMemoryNotificationStore::copy);
    }

    @Override
    public Notification insert(Notification notification) {
        Notification row = copy(notification);
        row.setId(ids.incrementAndGet());
        if (row.getUpdatedAt() == null) {
            row.setUpdatedAt(Instant.now());
        }
        if (row.getCreatedAt() == null) {
            row.setCreatedAt(row.getUpdatedAt());
        }
        rows.put(row.getId(), row);
        return copy(row);
    }

    @Override
    public boolean claim(Long id, NotificationStatus expected, Instant now) {
        return transition(id, n -> n.getStatus() == expected, n -> {
            n.setStatus(NotificationStatus.PROCESSING);
            n.setAttemptCount(n.getAttemptCount() + 1);
            n.setUpdatedAt(now);
        });
    }

    @Override
    public boolean markSent(Long id, String transactionId, Instant now) {
        return transition(id, n -> n.getStatus() == NotificationStatus.PROCESSING, n -> {
            n.setStatus(NotificationStatus.SENT);
            n.setTransactionId(transactionId);
            n.setErrorDetails(null);
            n.setProcessedAt(now);
            n.setUpdatedAt(now);
        });
    }

    @Override
    public boolean markFailed(Long id, String errorDetails, Instant now) {
        return transition(id, n -> n.getStatus() == NotificationStatus.PROCESSING, n -> {
            n.setStatus(NotificationStatus.FAILED);
            n.setErrorDetails(errorDetails);
            n.setUpdatedAt(now);
        });
    }

    @Override
    public boolean retract(Long id, String reason, Instant now) {
        return transition(id,
                n -> n.getStatus() == NotificationStatus.PENDING || n.getStatus() == NotificationStatus.FAILED,
                n -> {
                    n.setStatus(NotificationStatus.RETRACTED);
                    n.setRetractedAt(now);
                    n.setRetractionReason(reason);
                    n.setUpdatedAt(now);
                });
    }

    @Override
    public boolean releaseStale(Long id, Instant cutoff, String errorDetails, Instant now) {
        return transition(id,
                n -> n.getStatus() == NotificationStatus.PROCESSING && n.getUpdatedAt().isBefore(cutoff),
                n -> {
                    n.setStatus(NotificationStatus.FAILED);
                    n.setErrorDetails(errorDetails);
                    n.setUpdatedAt(now);
                });
    }

    public Notification get(Long id) {
        return findById(id).orElseThrow();
    }

    private boolean transition(Long id, Predicate<Notification> guard, Consumer<Notification> change) {
        boolean[] applied = {false};
        rows.computeIfPresent(id, (key, row) -> {
            if (guard.test(row)) {
                change.accept(row);
                applied[0] = true;
            }
            return row;
        });
        return applied[0];
    }

    private List<Notification> select(Predicate<Notification> filter, Comparator<Notification> order, int limit) {
        return rows.values().stream()
                .map(InMemoryNotificationStore::copy)
                .filter(filter)
                .sorted(order)
                .limit(limit)
                .toList();
    }

    private static boolean matches(UUID enterpriseId, Notification notification) {
        return enterpriseId == null || Objects.equals(enterpriseId, notification.getEnterpriseId());
    }

    private static Notification copy(Notification source) {
        return source.toBuilder().build();
    }
}
