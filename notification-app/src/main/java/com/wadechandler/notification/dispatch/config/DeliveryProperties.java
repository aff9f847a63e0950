package com.wadechandler.notification.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Connection settings for the delivery trigger service.
 */
@Configuration
@ConfigurationProperties(prefix = "notify.delivery")
@Data
public class DeliveryProperties {

    private String baseUrl = "https://api.novu.co";

    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * A trigger call still unanswered after this long is recorded as a failure.
     */
    private Duration readTimeout = Duration.ofSeconds(10);
}
