package com.marketplace.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketplace.notification.NotificationTemplateEngine;
import com.marketplace.notification.NotificationTemplateEngine.RenderedText;
import com.marketplace.translation.OrderRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NotificationTemplateEngineTest {

    private final NotificationTemplateEngine engine = new NotificationTemplateEngine();

    @Test
    @DisplayName("payment text depends on the reader's role")
    void paymentByRole() {
        RenderedText buyer = engine.paymentCompleted(OrderRole.BUYER, "Desk");
        RenderedText seller = engine.paymentCompleted(OrderRole.SELLER, null);

        assertThat(buyer.title()).isEqualTo("Payment Completed");
        assertThat(buyer.body()).isEqualTo("Payment for Desk has been processed");
        assertThat(seller.body()).isEqualTo("Payment received for your product");
    }

    @Test
    @DisplayName("blank titles fall back like missing ones")
    void blankTitleFallsBack() {
        assertThat(engine.orderStatusChanged("  ", "shipped").body()).isEqualTo("Order for product is now shipped");
        assertThat(engine.messageReceived("").body()).isEqualTo("You have a new message about a marketplace item");
    }
}
