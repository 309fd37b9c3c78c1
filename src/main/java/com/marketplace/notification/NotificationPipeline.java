package com.marketplace.notification;

import com.marketplace.event.EventPublisherHelper;
import com.marketplace.exception.TranslationException;
import com.marketplace.realtime.ChangeEventListener;
import com.marketplace.realtime.DeliveryGuard;
import com.marketplace.realtime.RawChangeEvent;
import com.marketplace.realtime.StreamDeclaration;
import com.marketplace.translation.EventTranslator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes order and message streams of one session: translate, then insert.
 *
 * <p>A malformed event is logged, reported as TRANSLATION_FAILED and dropped; the stream
 * keeps going. Duplicates (same notification id) are reported and otherwise ignored.
 */
public class NotificationPipeline implements ChangeEventListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationPipeline.class);

    private final String userId;
    private final EventTranslator eventTranslator;
    private final NotificationStore notificationStore;
    private final EventPublisherHelper eventPublisherHelper;

    public NotificationPipeline(
            String userId,
            EventTranslator eventTranslator,
            NotificationStore notificationStore,
            EventPublisherHelper eventPublisherHelper) {
        this.userId = userId;
        this.eventTranslator = eventTranslator;
        this.notificationStore = notificationStore;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void onChangeEvent(StreamDeclaration stream, RawChangeEvent event) {
        onChangeEvent(stream, event, DeliveryGuard.ALWAYS);
    }

    /** Translation (and its product lookup) runs unguarded; only the insert is committed through {@code guard}. */
    @Override
    public void onChangeEvent(StreamDeclaration stream, RawChangeEvent event, DeliveryGuard guard) {
        log.debug("Change on {} for user {}: {} {}", stream.getId(), userId, event.getEntity(), event.getOperation());

        Optional<Notification> translated;
        try {
            translated = eventTranslator.translate(event, userId);
        } catch (TranslationException e) {
            log.warn("Dropping malformed event on {} for user {}: {} {}",
                    stream.getId(), userId, e.getMessage(), e.getDetails());
            eventPublisherHelper.publishTranslationFailed(this, userId, e.getMessage());
            return;
        }

        if (translated.isEmpty()) {
            return;
        }

        Notification notification = translated.get();
        AtomicBoolean inserted = new AtomicBoolean();
        if (!guard.runIfCurrent(() -> inserted.set(notificationStore.insert(notification)))) {
            log.debug("Session for user {} stopped before notification {} was stored", userId, notification.getId());
            return;
        }
        if (!inserted.get()) {
            log.debug("Duplicate notification {} for user {} suppressed", notification.getId(), userId);
            eventPublisherHelper.publishNotificationDuplicate(this, userId, notification);
        }
    }
}
