package org.example.modelgen.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.modelgen.model.SubmittedTask;
import org.example.modelgen.model.TaskStatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Gateway implementation for the Tripo v2 OpenAPI.
 * Every response is wrapped in an envelope: {@code {"code": 0, "data": {...}}} on success,
 * {@code {"code": <n>, "message": "..."}} on application errors.
 */
public class TripoGenerationGateway implements GenerationGateway {

    private static final Logger log = LoggerFactory.getLogger(TripoGenerationGateway.class);

    private final WebClient webClient;
    private final String apiKey;
    private final Duration submitTimeout;
    private final Duration statusTimeout;
    private final ObjectMapper objectMapper;

    public TripoGenerationGateway(
            WebClient webClient,
            String apiKey,
            Duration submitTimeout,
            Duration statusTimeout,
            ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.submitTimeout = submitTimeout;
        this.statusTimeout = statusTimeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public SubmittedTask submitImageToModel(String imageUrl, String fileType) {
        ObjectNode requestPayload = objectMapper.createObjectNode();
        requestPayload.put("type", "image_to_model");
        ObjectNode file = requestPayload.putObject("file");
        file.put("type", fileType);
        file.put("url", imageUrl);

        log.debug("Submitting Tripo task payload: {}", requestPayload);
        JsonNode data = exchange(webClient.post()
                .uri("/v2/openapi/task")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestPayload.toString())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(submitTimeout), "submit task");

        JsonNode taskId = data.get("task_id");
        if (taskId == null || taskId.asText().isBlank()) {
            log.error("Unexpected Tripo submit response format: {}", data);
            throw new GenerationGatewayException("Unexpected response format: missing task_id");
        }
        log.info("Submitted Tripo task, task_id: {}", taskId.asText());
        return new SubmittedTask(taskId.asText(), requestPayload);
    }

    @Override
    public TaskStatusReport getTaskStatus(String taskId) {
        log.debug("Fetching Tripo task status for {}", taskId);
        JsonNode data = exchange(webClient.get()
                .uri("/v2/openapi/task/{taskId}", taskId)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(statusTimeout), "fetch task status");
        return TaskStatusReport.fromData(data);
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Tripo not available: API key not configured");
            return false;
        }
        return true;
    }

    @Override
    public String getProviderName() {
        return "tripo";
    }

    private JsonNode exchange(Mono<String> call, String operation) {
        String body;
        try {
            body = call.block();
        } catch (WebClientResponseException e) {
            log.error("Tripo API returned HTTP {} on {}: {}", e.getStatusCode().value(), operation,
                    e.getResponseBodyAsString());
            throw new GenerationGatewayException("HTTP " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            log.error("Tripo request failed on {}: {}", operation, e.getMessage());
            throw new GenerationGatewayException("Request to Tripo failed: " + describe(e), e);
        }
        return unwrapEnvelope(body);
    }

    private JsonNode unwrapEnvelope(String body) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            log.error("Failed to decode Tripo response: {}", e.getMessage());
            throw new GenerationGatewayException("Failed to decode response", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new GenerationGatewayException("Failed to decode response: not a JSON object");
        }

        JsonNode code = envelope.get("code");
        if (code != null && code.asInt(-1) == 0 && envelope.has("data") && envelope.get("data").isObject()) {
            return envelope.get("data");
        }
        if (code != null && code.asInt(-1) != 0) {
            String message = envelope.path("message").asText("unknown error");
            log.error("Tripo API error: code={}, message={}", code.asText(), message);
            throw new GenerationGatewayException("API error: " + message);
        }
        throw new GenerationGatewayException("Unexpected response format");
    }

    private String describe(Exception e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return (message == null || message.isBlank()) ? root.getClass().getSimpleName() : message;
    }
}
