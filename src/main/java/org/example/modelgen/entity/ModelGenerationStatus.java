package org.example.modelgen.entity;

/**
 * Generation phase recorded on a product. Persisted as the lowercase wire value.
 */
public enum ModelGenerationStatus {
    NONE("none"),
    QUEUED("queued"),
    DOWNLOADING("downloading"),
    COMPLETED("completed"),
    FAILED("failed"),
    TIMEOUT("timeout"),
    DOWNLOAD_FAILED("download_failed"),
    DISABLED("disabled"),
    SKIPPED("skipped"),
    SERVICE_DISABLED("service_disabled"),
    QUEUE_FAILED("queue_failed");

    private final String value;

    ModelGenerationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ModelGenerationStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (ModelGenerationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown model generation status: " + value);
    }
}
