package org.example.modelgen.model;

import com.fasterxml.jackson.databind.JsonNode;

public record SubmittedTask(String taskId, JsonNode requestPayload) {
}
