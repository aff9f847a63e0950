package com.wadechandler.notification.dispatch.repository;

import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.PublishStatus;
import com.wadechandler.notification.dispatch.model.TriggerType;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationRuleRepository extends JpaRepository<NotificationRule, Long> {

    List<NotificationRule> findByTriggerTypeAndPublishStatusAndDeactivatedFalse(
            TriggerType triggerType, PublishStatus publishStatus);

    List<NotificationRule> findByTriggerTypeAndPublishStatusAndDeactivatedFalseAndEnterpriseId(
            TriggerType triggerType, PublishStatus publishStatus, UUID enterpriseId);

    List<NotificationRule> findByUpdatedAtAfter(Instant cursor, Pageable pageable);

    List<NotificationRule> findByUpdatedAtAfterAndEnterpriseId(Instant cursor, UUID enterpriseId, Pageable pageable);

    Optional<NotificationRule> findByIdAndEnterpriseId(Long id, UUID enterpriseId);

    /**
     * Every rule that should currently own a schedule, optionally for one enterprise.
     */
    default List<NotificationRule> findActiveCronRules(UUID enterpriseId) {
        return enterpriseId == null
                ? findByTriggerTypeAndPublishStatusAndDeactivatedFalse(TriggerType.CRON, PublishStatus.PUBLISH)
                : findByTriggerTypeAndPublishStatusAndDeactivatedFalseAndEnterpriseId(
                        TriggerType.CRON, PublishStatus.PUBLISH, enterpriseId);
    }

    /**
     * Rules of any trigger type written strictly after {@code cursor}, oldest first.
     */
    default List<NotificationRule> findChangedSince(Instant cursor, UUID enterpriseId, int limit) {
        Pageable page = PageRequest.of(0, limit, Sort.by("updatedAt", "id"));
        return enterpriseId == null
                ? findByUpdatedAtAfter(cursor, page)
                : findByUpdatedAtAfterAndEnterpriseId(cursor, enterpriseId, page);
    }
}
