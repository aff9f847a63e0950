package com.wadechandler.notification.dispatch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A delivery workflow known to the trigger service. {@code workflowKey} is the name the
 * trigger API is invoked with; rows with a null enterprise are shared by all tenants.
 */
@Entity
@Table(name = "notification_workflows")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationWorkflowDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private UUID enterpriseId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String workflowKey;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> defaultChannels;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PublishStatus publishStatus = PublishStatus.DRAFT;

    @Column(nullable = false)
    @Builder.Default
    private boolean deactivated = false;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private Instant updatedAt;
}
