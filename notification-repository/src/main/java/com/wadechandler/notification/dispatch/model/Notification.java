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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single notification to be handed to the delivery trigger service.
 * <p>
 * Status moves only through the conditional bulk updates in {@code NotificationRepository},
 * which bypass {@link UpdateTimestamp} and therefore set {@code updatedAt} themselves.
 */
@Entity
@Table(name = "notifications")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private UUID enterpriseId;

    private UUID businessId;

    @Column(nullable = false)
    private Long notificationWorkflowId;

    private Long notificationRuleId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<String> recipients;

    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<String> channels = new ArrayList<>(List.of(NotificationChannel.IN_APP.name()));

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> overrides;

    private Instant scheduledFor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private NotificationStatus status = NotificationStatus.PENDING;

    private String transactionId;

    @Column(columnDefinition = "TEXT")
    private String errorDetails;

    @Column(nullable = false)
    @Builder.Default
    private int attemptCount = 0;

    private Instant processedAt;

    private Instant retractedAt;

    @Column(columnDefinition = "TEXT")
    private String retractionReason;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private Instant updatedAt;
}
