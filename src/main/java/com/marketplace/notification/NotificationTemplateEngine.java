package com.marketplace.notification;

import com.marketplace.translation.OrderRole;
import org.springframework.stereotype.Component;

/**
 * Renders the title and body of each notification kind.
 *
 * <p>Text depends on which side of the trade the reader is on. When the product title is
 * unknown, a generic label is used instead: "product" when addressing the buyer, "your
 * product" when addressing the seller, "a marketplace item" for messages.
 */
@Component
public class NotificationTemplateEngine {

    static final String BUYER_PRODUCT_FALLBACK = "product";
    static final String SELLER_PRODUCT_FALLBACK = "your product";
    static final String MESSAGE_SUBJECT_FALLBACK = "a marketplace item";

    public record RenderedText(String title, String body) {}

    public RenderedText orderCreated(OrderRole role, String productTitle) {
        return switch (role) {
            case BUYER -> new RenderedText(
                    "Order Placed",
                    "Your order for " + orFallback(productTitle, BUYER_PRODUCT_FALLBACK)
                            + " has been placed successfully");
            case SELLER -> new RenderedText(
                    "New Order Received",
                    "You received a new order for " + orFallback(productTitle, SELLER_PRODUCT_FALLBACK));
        };
    }

    public RenderedText orderStatusChanged(String productTitle, String newStatus) {
        return new RenderedText(
                "Order Status Updated",
                "Order for " + orFallback(productTitle, BUYER_PRODUCT_FALLBACK) + " is now " + newStatus);
    }

    public RenderedText paymentCompleted(OrderRole role, String productTitle) {
        return switch (role) {
            case BUYER -> new RenderedText(
                    "Payment Completed",
                    "Payment for " + orFallback(productTitle, BUYER_PRODUCT_FALLBACK) + " has been processed");
            case SELLER -> new RenderedText(
                    "Payment Completed",
                    "Payment received for " + orFallback(productTitle, SELLER_PRODUCT_FALLBACK));
        };
    }

    public RenderedText messageReceived(String subject) {
        return new RenderedText(
                "New Message", "You have a new message about " + orFallback(subject, MESSAGE_SUBJECT_FALLBACK));
    }

    private static String orFallback(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
