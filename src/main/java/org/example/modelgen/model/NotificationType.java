package org.example.modelgen.model;

public enum NotificationType {
    GENERATION_STARTED("generation_started"),
    MODEL_GENERATED("model_generated"),
    MODEL_READY("model_ready"),
    MODEL_FAILED("model_failed");

    private final String eventName;

    NotificationType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
