package org.example.modelgen.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One decoded status response for a generation task.
 *
 * @param rawStatus         status string exactly as the service sent it
 * @param status            classified status
 * @param progress          reported progress, or null when absent
 * @param modelUrl          remote URL of the PBR model, once available
 * @param renderedImageUrl  remote URL of the rendered preview, once available
 * @param generatedImageUrl remote URL of the intermediate generated image, if any
 * @param error             service-reported error text, if any
 * @param payload           the full {@code data} object for auditing
 */
public record TaskStatusReport(
        String rawStatus,
        TaskStatus status,
        Integer progress,
        String modelUrl,
        String renderedImageUrl,
        String generatedImageUrl,
        String error,
        JsonNode payload
) {

    public static TaskStatusReport fromData(JsonNode data) {
        String rawStatus = text(data, "status");
        Integer progress = null;
        JsonNode progressNode = data.get("progress");
        if (progressNode != null && progressNode.isNumber()) {
            progress = progressNode.asInt();
        }
        return new TaskStatusReport(
                rawStatus,
                TaskStatus.parse(rawStatus),
                progress,
                text(data.path("result").path("pbr_model"), "url"),
                text(data.path("result").path("rendered_image"), "url"),
                text(data.path("output"), "generated_image"),
                text(data, "error"),
                data
        );
    }

    /**
     * Copy of this report reclassified as a failure with the given error.
     */
    public TaskStatusReport asFailure(String failure) {
        return new TaskStatusReport(
                TaskStatus.FAILED.value(),
                TaskStatus.FAILED,
                progress,
                modelUrl,
                renderedImageUrl,
                generatedImageUrl,
                failure,
                payload
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
