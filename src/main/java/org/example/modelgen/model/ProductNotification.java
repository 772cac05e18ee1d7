package org.example.modelgen.model;

import java.util.Map;

public record ProductNotification(
        String topic,
        NotificationType type,
        String productId,
        Map<String, Object> payload
) {

    public static String productTopic(String productId) {
        return "product:" + productId;
    }

    public static String updatesTopic(String productId) {
        return "product_updates:" + productId;
    }
}
