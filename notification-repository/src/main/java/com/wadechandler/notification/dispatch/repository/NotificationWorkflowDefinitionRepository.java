package com.wadechandler.notification.dispatch.repository;

import com.wadechandler.notification.dispatch.model.NotificationWorkflowDefinition;
import com.wadechandler.notification.dispatch.model.PublishStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface NotificationWorkflowDefinitionRepository extends JpaRepository<NotificationWorkflowDefinition, Long> {

    Optional<NotificationWorkflowDefinition> findByIdAndEnterpriseIdAndPublishStatusAndDeactivatedFalse(
            Long id, UUID enterpriseId, PublishStatus publishStatus);

    Optional<NotificationWorkflowDefinition> findByIdAndEnterpriseIdIsNullAndPublishStatusAndDeactivatedFalse(
            Long id, PublishStatus publishStatus);

    /**
     * Published, non-deactivated workflow by id. The enterprise's own definition wins
     * over a shared one (null enterprise).
     */
    default Optional<NotificationWorkflowDefinition> findPublished(Long id, UUID enterpriseId) {
        if (enterpriseId != null) {
            Optional<NotificationWorkflowDefinition> own =
                    findByIdAndEnterpriseIdAndPublishStatusAndDeactivatedFalse(id, enterpriseId, PublishStatus.PUBLISH);
            if (own.isPresent()) {
                return own;
            }
        }
        return findByIdAndEnterpriseIdIsNullAndPublishStatusAndDeactivatedFalse(id, PublishStatus.PUBLISH);
    }
}
