package org.example.modelgen.service;

import org.example.modelgen.model.NotificationType;
import org.example.modelgen.model.ProductNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds generation events and sends them on the product topic and the product-updates topic.
 * Publishing never fails the calling step.
 */
@Service
public class ProductNotificationService {

    private static final Logger log = LoggerFactory.getLogger(ProductNotificationService.class);

    private final NotificationChannel notificationChannel;

    public ProductNotificationService(NotificationChannel notificationChannel) {
        this.notificationChannel = notificationChannel;
    }

    public void generationStarted(String productId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("product_id", productId);
        payload.put("started_at", LocalDateTime.now().toString());
        send(ProductNotification.productTopic(productId), NotificationType.GENERATION_STARTED, productId, payload);
        send(ProductNotification.updatesTopic(productId), NotificationType.GENERATION_STARTED, productId,
                Map.of("product_id", productId));
    }

    public void modelReady(String productId, String modelUrl) {
        send(ProductNotification.productTopic(productId), NotificationType.MODEL_GENERATED, productId,
                Map.of("model_url", modelUrl));
        send(ProductNotification.updatesTopic(productId), NotificationType.MODEL_READY, productId,
                Map.of("product_id", productId, "model_url", modelUrl));
        log.info("Broadcasted model_ready event for product {}", productId);
    }

    public void modelFailed(String productId, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("product_id", productId);
        payload.put("error", error == null ? "unknown" : error);
        send(ProductNotification.productTopic(productId), NotificationType.MODEL_FAILED, productId, payload);
        send(ProductNotification.updatesTopic(productId), NotificationType.MODEL_FAILED, productId, payload);
    }

    private void send(String topic, NotificationType type, String productId, Map<String, Object> payload) {
        try {
            notificationChannel.publish(new ProductNotification(topic, type, productId, Map.copyOf(payload)));
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for product {} on {}", type.eventName(), productId, topic, e);
        }
    }
}
