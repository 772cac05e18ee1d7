package org.example.modelgen.service.gateway;

import org.example.modelgen.model.SubmittedTask;
import org.example.modelgen.model.TaskStatusReport;

/**
 * Abstraction over the external image-to-3D generation service.
 */
public interface GenerationGateway {

    /**
     * Start an image-to-model task.
     *
     * @param imageUrl publicly reachable source image
     * @param fileType image type hint (jpg, png, webp)
     * @return the task id assigned by the service together with the payload that was sent
     * @throws GenerationGatewayException if the service rejects the request or cannot be reached
     */
    SubmittedTask submitImageToModel(String imageUrl, String fileType);

    /**
     * Fetch the current status of a task.
     *
     * @throws GenerationGatewayException on transport errors, non-2xx responses,
     *                                    application error codes or undecodable bodies
     */
    TaskStatusReport getTaskStatus(String taskId);

    /**
     * Check if the gateway is configured and usable.
     */
    boolean isAvailable();

    String getProviderName();
}
