package org.example.modelgen.service.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.modelgen.model.SubmittedTask;
import org.example.modelgen.model.TaskStatus;
import org.example.modelgen.model.TaskStatusReport;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TripoGenerationGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void submitImageToModel_postsImageToModelTaskAndReturnsTaskId() {
        TripoGenerationGateway gateway = gateway("key", HttpStatus.OK,
                "{\"code\":0,\"data\":{\"task_id\":\"task-123\"}}");

        SubmittedTask task = gateway.submitImageToModel("https://img.example/lamp.png", "png");

        assertEquals("task-123", task.taskId());
        assertEquals("image_to_model", task.requestPayload().path("type").asText());
        assertEquals("png", task.requestPayload().path("file").path("type").asText());
        assertEquals("https://img.example/lamp.png", task.requestPayload().path("file").path("url").asText());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("/v2/openapi/task", requests.get(0).url().getPath());
    }

    @Test
    void submitImageToModel_missingTaskId_throws() {
        TripoGenerationGateway gateway = gateway("key", HttpStatus.OK, "{\"code\":0,\"data\":{}}");

        GenerationGatewayException error = assertThrows(GenerationGatewayException.class,
                () -> gateway.submitImageToModel("https://img.example/lamp.png", "png"));
        assertTrue(error.getMessage().contains("task_id"));
    }

    @Test
    void getTaskStatus_decodesEnvelope() {
        TripoGenerationGateway gateway = gateway("key", HttpStatus.OK,
                "{\"code\":0,\"data\":{\"status\":\"running\",\"progress\":35}}");

        TaskStatusReport report = gateway.getTaskStatus("task-123");

        assertEquals("running", report.rawStatus());
        assertEquals(TaskStatus.PROCESSING, report.status());
        assertEquals(35, report.progress());
        assertEquals(HttpMethod.GET, requests.get(0).method());
        assertEquals("/v2/openapi/task/task-123", requests.get(0).url().getPath());
    }

    @Test
    void getTaskStatus_nonZeroCode_isApiError() {
        TripoGenerationGateway gateway = gateway("key", HttpStatus.OK,
                "{\"code\":2001,\"message\":\"task not found\"}");

        GenerationGatewayException error = assertThrows(GenerationGatewayException.class,
                () -> gateway.getTaskStatus("task-123"));
        assertEquals("API error: task not found", error.getMessage());
    }

    @Test
    void getTaskStatus_httpError_reportsStatusCode() {
        TripoGenerationGateway gateway = gateway("key", HttpStatus.SERVICE_UNAVAILABLE, "{}");

        GenerationGatewayException error = assertThrows(GenerationGatewayException.class,
                () -> gateway.getTaskStatus("task-123"));
        assertEquals("HTTP 503", error.getMessage());
    }

    @Test
    void getTaskStatus_malformedBody_isDecodeError() {
        TripoGenerationGateway gateway = gateway("key", HttpStatus.OK, "<html>oops</html>");

        GenerationGatewayException error = assertThrows(GenerationGatewayException.class,
                () -> gateway.getTaskStatus("task-123"));
        assertTrue(error.getMessage().startsWith("Failed to decode response"));
    }

    @Test
    void getTaskStatus_transportFailure_isWrapped() {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.tripo.test")
                .exchangeFunction(request -> Mono.error(new IOException("connection reset")))
                .build();
        TripoGenerationGateway gateway = new TripoGenerationGateway(
                webClient, "key", Duration.ofSeconds(5), Duration.ofSeconds(5), objectMapper);

        GenerationGatewayException error = assertThrows(GenerationGatewayException.class,
                () -> gateway.getTaskStatus("task-123"));
        assertEquals("Request to Tripo failed: connection reset", error.getMessage());
    }

    @Test
    void isAvailable_requiresApiKey() {
        assertTrue(gateway("key", HttpStatus.OK, "{}").isAvailable());
        assertFalse(gateway("", HttpStatus.OK, "{}").isAvailable());
        assertFalse(gateway(null, HttpStatus.OK, "{}").isAvailable());
        assertEquals("tripo", gateway("key", HttpStatus.OK, "{}").getProviderName());
    }

    private TripoGenerationGateway gateway(String apiKey, HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.tripo.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new TripoGenerationGateway(webClient, apiKey, Duration.ofSeconds(5), Duration.ofSeconds(5), objectMapper);
    }
}
