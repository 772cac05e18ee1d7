package org.example.modelgen.service.job;

/**
 * Arguments carried by a generation job. Fields not relevant to a job type are null.
 */
public record JobArgs(
        String productId,
        String taskId,
        String modelUrl,
        String imageUrl
) {

    public static JobArgs forProduct(String productId) {
        return new JobArgs(productId, null, null, null);
    }

    public static JobArgs forTask(String productId, String taskId) {
        return new JobArgs(productId, taskId, null, null);
    }

    public static JobArgs forDownload(String productId, String taskId, String modelUrl, String imageUrl) {
        return new JobArgs(productId, taskId, modelUrl, imageUrl);
    }
}
