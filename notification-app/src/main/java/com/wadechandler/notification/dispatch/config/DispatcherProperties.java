package com.wadechandler.notification.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;

/**
 * Polling dispatcher settings.
 * <pre>
 * notify:
 *   dispatcher:
 *     poll-interval: 5s
 *     max-concurrency: 10
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "notify.dispatcher")
@Data
public class DispatcherProperties {

    private boolean autoStart = true;

    private Duration pollInterval = Duration.ofSeconds(5);

    private Duration scheduledPollInterval = Duration.ofSeconds(10);

    private Duration failedPollInterval = Duration.ofSeconds(60);

    /**
     * The failed-retry poll waits this long after start-up before its first run.
     */
    private Duration failedInitialDelay = Duration.ofSeconds(30);

    private Duration staleCheckInterval = Duration.ofSeconds(60);

    /**
     * A PROCESSING row untouched for this long is presumed abandoned and moved to FAILED.
     */
    private Duration processingTimeout = Duration.ofMinutes(15);

    private int batchSize = 50;

    /**
     * Upper bound on simultaneous delivery trigger calls.
     */
    private int maxConcurrency = 10;

    /**
     * Claims per notification after which a FAILED row is no longer retried.
     */
    private int maxAttempts = 5;

    /**
     * Drop the status filter of the new-notification poll. Replay and debugging only.
     */
    private boolean includeProcessed = false;

    /**
     * How long stop waits for in-flight dispatches.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private UUID enterpriseId;
}
