package org.example.modelgen.service;

import org.example.modelgen.model.NotificationType;
import org.example.modelgen.model.ProductNotification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ProductNotificationServiceTest {

    @Mock
    private NotificationChannel notificationChannel;

    @Test
    void modelReady_sendsGeneratedAndReadyEvents() {
        ProductNotificationService service = new ProductNotificationService(notificationChannel);

        service.modelReady("p1", "/3d/products/p1/model.glb");

        ArgumentCaptor<ProductNotification> captor = ArgumentCaptor.forClass(ProductNotification.class);
        verify(notificationChannel, times(2)).publish(captor.capture());
        List<ProductNotification> sent = captor.getAllValues();

        assertEquals("product:p1", sent.get(0).topic());
        assertEquals(NotificationType.MODEL_GENERATED, sent.get(0).type());
        assertEquals("/3d/products/p1/model.glb", sent.get(0).payload().get("model_url"));

        assertEquals("product_updates:p1", sent.get(1).topic());
        assertEquals(NotificationType.MODEL_READY, sent.get(1).type());
        assertEquals("p1", sent.get(1).payload().get("product_id"));
        assertEquals("/3d/products/p1/model.glb", sent.get(1).payload().get("model_url"));
    }

    @Test
    void modelFailed_sendsOnBothTopicsWithError() {
        ProductNotificationService service = new ProductNotificationService(notificationChannel);

        service.modelFailed("p1", "bad mesh");

        ArgumentCaptor<ProductNotification> captor = ArgumentCaptor.forClass(ProductNotification.class);
        verify(notificationChannel, times(2)).publish(captor.capture());
        for (ProductNotification notification : captor.getAllValues()) {
            assertEquals(NotificationType.MODEL_FAILED, notification.type());
            assertEquals("bad mesh", notification.payload().get("error"));
        }
        assertEquals("product:p1", captor.getAllValues().get(0).topic());
        assertEquals("product_updates:p1", captor.getAllValues().get(1).topic());
    }

    @Test
    void publishFailures_areSwallowedAndLogged() {
        doThrow(new IllegalStateException("broker down")).when(notificationChannel).publish(any());
        ProductNotificationService service = new ProductNotificationService(notificationChannel);

        assertDoesNotThrow(() -> service.generationStarted("p1"));
        verify(notificationChannel, times(2)).publish(any());
    }
}
