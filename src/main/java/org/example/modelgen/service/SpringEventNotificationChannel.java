package org.example.modelgen.service;

import org.example.modelgen.model.ProductNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes notifications as Spring application events; observers subscribe with {@code @EventListener}.
 */
@Component
public class SpringEventNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SpringEventNotificationChannel.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringEventNotificationChannel(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(ProductNotification notification) {
        log.debug("Publishing {} on {}", notification.type().eventName(), notification.topic());
        applicationEventPublisher.publishEvent(notification);
    }
}
