package com.marketplace.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.marketplace.event.ConnectivityEvent;
import com.marketplace.event.EventPublisherHelper;
import com.marketplace.event.NotificationEvent;
import com.marketplace.event.NotificationEventType;
import com.marketplace.event.ToastEvent;
import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationKind;
import com.marketplace.realtime.ConnectivityState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper helper;

    @BeforeEach
    void setUp() {
        helper = new EventPublisherHelper(applicationEventPublisher);
    }

    private ApplicationEvent published() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    @Test
    void translationFailure_hasNoNotification() {
        helper.publishTranslationFailed(this, "u1", "missing id");

        NotificationEvent event = (NotificationEvent) published();
        assertThat(event.getEventType()).isEqualTo(NotificationEventType.TRANSLATION_FAILED);
        assertThat(event.getNotification()).isNull();
        assertThat(event.getMessage()).isEqualTo("missing id");
        assertThat(event.getSource()).isSameAs(this);
    }

    @Test
    void delivered_carriesTheNotification() {
        Notification notification = Notification.builder().id("message_m1").build();

        helper.publishNotificationDelivered(this, "u1", notification);

        NotificationEvent event = (NotificationEvent) published();
        assertThat(event.getEventType()).isEqualTo(NotificationEventType.DELIVERED);
        assertThat(event.getNotification()).isSameAs(notification);
        assertThat(event.getUserId()).isEqualTo("u1");
    }

    @Test
    void connectivity_carriesBothStates() {
        helper.publishConnectivity(this, "u1", ConnectivityState.CONNECTING, ConnectivityState.CONNECTED, 0);

        ConnectivityEvent event = (ConnectivityEvent) published();
        assertThat(event.getPreviousState()).isEqualTo(ConnectivityState.CONNECTING);
        assertThat(event.getNewState()).isEqualTo(ConnectivityState.CONNECTED);
    }

    @Test
    void toast_carriesKindAndText() {
        helper.publishToast(this, "u1", NotificationKind.PAYMENT_COMPLETED, "Payment Completed", "Payment received");

        ToastEvent event = (ToastEvent) published();
        assertThat(event.getKind()).isEqualTo(NotificationKind.PAYMENT_COMPLETED);
        assertThat(event.getTitle()).isEqualTo("Payment Completed");
    }
}
