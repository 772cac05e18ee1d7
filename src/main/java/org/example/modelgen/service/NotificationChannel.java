package org.example.modelgen.service;

import org.example.modelgen.model.ProductNotification;

/**
 * Broadcast transport for generation events. Delivery is best effort.
 */
public interface NotificationChannel {

    void publish(ProductNotification notification);
}
