package com.marketplace.translation;

import com.marketplace.exception.TranslationException;
import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationKind;
import com.marketplace.notification.NotificationPayload;
import com.marketplace.notification.NotificationTemplateEngine;
import com.marketplace.notification.NotificationTemplateEngine.RenderedText;
import com.marketplace.realtime.ChangeOperation;
import com.marketplace.realtime.EntityType;
import com.marketplace.realtime.RawChangeEvent;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps raw change events to zero or one user-facing {@link Notification}.
 *
 * <p>Rules are keyed by (entity, operation); a pair without a rule produces nothing.
 * <ul>
 *   <li>Order CREATED: "order placed" for the buyer, "new order" for the seller</li>
 *   <li>Order UPDATED: payment moving to {@code completed} wins over a status change;
 *       a status change alone yields a status notification; any other edit yields nothing</li>
 *   <li>Message CREATED: only messages whose metadata marks them as marketplace
 *       conversations</li>
 * </ul>
 *
 * <p>Stateless apart from the product lookup; the same event always produces the same
 * notification id. A structurally broken event raises {@link TranslationException}.
 */
@Component
public class EventTranslator {

    private static final Logger log = LoggerFactory.getLogger(EventTranslator.class);

    static final String PAYMENT_COMPLETED = "completed";
    static final String MARKETPLACE_MESSAGE_TYPE = "marketplace";

    @FunctionalInterface
    private interface Rule {
        Optional<Notification> apply(RawChangeEvent event, String observerId);
    }

    private record RuleKey(EntityType entity, ChangeOperation operation) {}

    private final ProductCatalog productCatalog;
    private final NotificationTemplateEngine templateEngine;
    private final Map<RuleKey, Rule> rules = new HashMap<>();

    public EventTranslator(ProductCatalog productCatalog, NotificationTemplateEngine templateEngine) {
        this.productCatalog = productCatalog;
        this.templateEngine = templateEngine;

        rules.put(new RuleKey(EntityType.ORDER, ChangeOperation.CREATED), this::orderCreated);
        rules.put(new RuleKey(EntityType.ORDER, ChangeOperation.UPDATED), this::orderUpdated);
        rules.put(new RuleKey(EntityType.MESSAGE, ChangeOperation.CREATED), this::messageCreated);
    }

    /**
     * Translates one raw event for the given observer.
     *
     * @param event      the raw change event
     * @param observerId id of the user the notification would be shown to
     * @return the notification, or empty when the event is not notification-worthy
     * @throws TranslationException if the event lacks data its entity requires
     */
    public Optional<Notification> translate(RawChangeEvent event, String observerId) {
        if (event == null || event.getEntity() == null || event.getOperation() == null) {
            throw new TranslationException("Change event without entity or operation");
        }
        Rule rule = rules.get(new RuleKey(event.getEntity(), event.getOperation()));
        if (rule == null) {
            log.debug("No notification rule for {} {}", event.getEntity(), event.getOperation());
            return Optional.empty();
        }
        return rule.apply(event, observerId);
    }

    // ---- Orders ----

    private Optional<Notification> orderCreated(RawChangeEvent event, String observerId) {
        RowSnapshot after = RowSnapshot.after(event);
        String orderId = after.require("id");
        Optional<OrderRole> role = roleOf(after, observerId);
        if (role.isEmpty()) {
            log.debug("User {} is not a party to order {}, skipping", observerId, orderId);
            return Optional.empty();
        }

        String productId = after.optional("product_id");
        String productTitle = lookupTitle(productId);
        RenderedText text = templateEngine.orderCreated(role.get(), productTitle);

        return Optional.of(build(
                "order_" + orderId + "_created",
                NotificationKind.ORDER_CREATED,
                text,
                NotificationPayload.forOrder(
                        orderId, productId, productTitle, after.optional("order_status"), role.get()),
                observerId,
                event));
    }

    private Optional<Notification> orderUpdated(RawChangeEvent event, String observerId) {
        RowSnapshot before = RowSnapshot.before(event);
        RowSnapshot after = RowSnapshot.after(event);
        String orderId = after.require("id");

        boolean paymentCompleted = before.differs(after, "payment_status")
                && PAYMENT_COMPLETED.equals(after.optional("payment_status"));
        boolean statusChanged = before.differs(after, "order_status");
        if (!paymentCompleted && !statusChanged) {
            log.debug("Order {} updated without status or payment transition, skipping", orderId);
            return Optional.empty();
        }

        Optional<OrderRole> role = roleOf(after, observerId);
        if (role.isEmpty()) {
            log.debug("User {} is not a party to order {}, skipping", observerId, orderId);
            return Optional.empty();
        }

        String productId = after.optional("product_id");
        String productTitle = lookupTitle(productId);

        if (paymentCompleted) {
            return Optional.of(build(
                    "order_" + orderId + "_payment_completed",
                    NotificationKind.PAYMENT_COMPLETED,
                    templateEngine.paymentCompleted(role.get(), productTitle),
                    NotificationPayload.forOrder(
                            orderId, productId, productTitle, after.optional("order_status"), role.get()),
                    observerId,
                    event));
        }

        String newStatus = after.require("order_status");
        return Optional.of(build(
                "order_" + orderId + "_status_" + newStatus,
                NotificationKind.ORDER_STATUS_CHANGED,
                templateEngine.orderStatusChanged(productTitle, newStatus),
                NotificationPayload.forOrder(orderId, productId, productTitle, newStatus, role.get()),
                observerId,
                event));
    }

    /**
     * Buyer wins when the observer is on both sides of the order.
     */
    private Optional<OrderRole> roleOf(RowSnapshot order, String observerId) {
        if (observerId == null) {
            return Optional.empty();
        }
        if (observerId.equals(order.optional("buyer_id"))) {
            return Optional.of(OrderRole.BUYER);
        }
        if (observerId.equals(order.optional("seller_id"))) {
            return Optional.of(OrderRole.SELLER);
        }
        return Optional.empty();
    }

    // ---- Messages ----

    private Optional<Notification> messageCreated(RawChangeEvent event, String observerId) {
        RowSnapshot after = RowSnapshot.after(event);
        String messageId = after.require("id");

        Map<String, Object> metadata = after.object("metadata");
        if (metadata == null || !MARKETPLACE_MESSAGE_TYPE.equals(metadata.get("type"))) {
            log.debug("Message {} is not a marketplace conversation, skipping", messageId);
            return Optional.empty();
        }
        String recipientId = after.optional("recipient_id");
        if (recipientId != null && !recipientId.equals(observerId)) {
            log.debug("Message {} is addressed to {}, not {}, skipping", messageId, recipientId, observerId);
            return Optional.empty();
        }

        Object subject = metadata.get("product_title");
        String productTitle = subject != null ? String.valueOf(subject) : null;

        return Optional.of(build(
                "message_" + messageId,
                NotificationKind.MESSAGE_RECEIVED,
                templateEngine.messageReceived(productTitle),
                NotificationPayload.forMessage(
                        messageId, after.optional("conversation_id"), after.optional("sender_id"), productTitle),
                observerId,
                event));
    }

    // ---- Helpers ----

    private String lookupTitle(String productId) {
        if (productId == null) {
            return null;
        }
        try {
            return productCatalog.findTitle(productId).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Product lookup for {} failed, using generic label: {}", productId, e.getMessage());
            return null;
        }
    }

    private static Notification build(
            String id,
            NotificationKind kind,
            RenderedText text,
            NotificationPayload payload,
            String observerId,
            RawChangeEvent event) {
        return Notification.builder()
                .id(id)
                .kind(kind)
                .title(text.title())
                .body(text.body())
                .payload(payload)
                .recipientId(observerId)
                .createdAt(event.getReceivedAt())
                .read(false)
                .build();
    }
}
