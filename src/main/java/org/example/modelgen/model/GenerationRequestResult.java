package org.example.modelgen.model;

public record GenerationRequestResult(
        String productId,
        Outcome outcome,
        String jobId,
        String message
) {

    public enum Outcome {
        QUEUED,
        ALREADY_IN_PROGRESS,
        DISABLED,
        SKIPPED,
        SERVICE_DISABLED,
        QUEUE_FAILED,
        PRODUCT_NOT_FOUND
    }

    public boolean queued() {
        return outcome == Outcome.QUEUED;
    }
}
