package com.wadechandler.notification.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;

/**
 * Rule-to-schedule reconciliation settings.
 * <pre>
 * notify:
 *   reconciler:
 *     poll-interval: 10s
 *     reconcile-interval: 5m
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "notify.reconciler")
@Data
public class ReconcilerProperties {

    /**
     * Start the sync loop with the application context.
     */
    private boolean autoStart = true;

    /**
     * Delay before the start-up reconciliation runs.
     */
    private Duration initialDelay = Duration.ZERO;

    /**
     * Interval between incremental scans for changed rules.
     */
    private Duration pollInterval = Duration.ofSeconds(10);

    /**
     * Interval between full rule/schedule reconciliations.
     */
    private Duration reconcileInterval = Duration.ofMinutes(5);

    /**
     * Maximum rules fetched per incremental scan.
     */
    private int batchSize = 100;

    /**
     * Restrict the loop to one enterprise. Unset means all enterprises.
     */
    private UUID enterpriseId;
}
