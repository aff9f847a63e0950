package com.wadechandler.notification.dispatch.delivery;

import com.wadechandler.notification.dispatch.exception.DeliveryTriggerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Novu-compatible trigger client: {@code POST /v1/events/trigger} with one subscriber per recipient.
 * The notification's channels travel in the payload under {@code channels}, replacing any payload value of that name.
 * Timeouts come from the request factory configured in {@link DeliveryClientConfig}.
 */
@Component
@Profile("dispatcher")
@Slf4j
public class HttpDeliveryTriggerClient implements DeliveryTriggerClient {

    static final String TRIGGER_PATH = "/v1/events/trigger";
    static final String CHANNELS_KEY = "channels";

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    public HttpDeliveryTriggerClient(@Qualifier("deliveryRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String trigger(TriggerRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", request.workflowKey());
        body.put("to", request.recipients().stream()
                .map(recipient -> Map.of("subscriberId", recipient))
                .toList());
        Map<String, Object> payload = request.payload() != null ? new LinkedHashMap<>(request.payload()) : new LinkedHashMap<>();
        if (request.channels() != null) {
            payload.put(CHANNELS_KEY, request.channels());
        }
        body.put("payload", payload);
        if (request.overrides() != null && !request.overrides().isEmpty()) {
            body.put("overrides", request.overrides());
        }
        if (request.enterpriseId() != null) {
            body.put("tenant", request.enterpriseId().toString());
        }

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri(TRIGGER_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(RESPONSE_TYPE);
        } catch (RestClientException e) {
            throw new DeliveryTriggerException(
                    "Trigger of workflow '" + request.workflowKey() + "' failed: " + e.getMessage(), e);
        }

        String transactionId = transactionId(response);
        if (transactionId == null) {
            throw new DeliveryTriggerException(
                    "Trigger of workflow '" + request.workflowKey() + "' returned no transaction id");
        }
        log.debug("Triggered workflow {} for notification {}: transaction {}",
                request.workflowKey(), request.notificationId(), transactionId);
        return transactionId;
    }

    private static String transactionId(Map<String, Object> response) {
        if (response == null) {
            return null;
        }
        Object data = response.get("data");
        Object id = data instanceof Map<?, ?> dataMap ? dataMap.get("transactionId") : response.get("transactionId");
        return id instanceof String text && !text.isBlank() ? text : null;
    }
}
