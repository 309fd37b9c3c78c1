package com.marketplace.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.marketplace.exception.NotificationPersistenceException;
import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationKind;
import com.marketplace.notification.NotificationPayload;
import com.marketplace.notification.RestNotificationCreator;
import com.marketplace.translation.OrderRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RestNotificationCreatorTest {

    private static final String BASE_URL = "http://marketplace.test";

    private MockRestServiceServer server;
    private RestNotificationCreator creator;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        creator = new RestNotificationCreator(builder.build());
    }

    private static Notification statusChange(String status) {
        return Notification.builder()
                .id("order_o1_status_" + status)
                .kind(NotificationKind.ORDER_STATUS_CHANGED)
                .title("Order Status Updated")
                .body("Order for Desk is now " + status)
                .recipientId("user-1")
                .payload(NotificationPayload.forOrder("o1", "p1", "Desk", status, OrderRole.BUYER))
                .build();
    }

    @Test
    @DisplayName("posts the notification and returns the server id")
    void postsNotification() {
        server.expect(requestTo(BASE_URL + "/api/notifications"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.recipient_id").value("user-1"))
                .andExpect(jsonPath("$.type").value("order_update"))
                .andExpect(jsonPath("$.message").value("Order for Desk is now shipped"))
                .andExpect(jsonPath("$.order_id").value("o1"))
                .andExpect(jsonPath("$.client_reference").value("order_o1_status_shipped"))
                .andExpect(jsonPath("$.sender_id").doesNotExist())
                .andRespond(withSuccess("{\"notification_id\":\"srv-42\"}", MediaType.APPLICATION_JSON));

        assertThat(creator.persist(statusChange("shipped"))).isEqualTo("srv-42");
        server.verify();
    }

    @Test
    @DisplayName("a delivered order is written as order_completed")
    void deliveredIsOrderCompleted() {
        server.expect(requestTo(BASE_URL + "/api/notifications"))
                .andExpect(jsonPath("$.type").value("order_completed"))
                .andRespond(withSuccess("{\"notification_id\":\"srv-43\"}", MediaType.APPLICATION_JSON));

        creator.persist(statusChange("delivered"));
        server.verify();
    }

    @Test
    @DisplayName("message notifications carry the sender")
    void messageCarriesSender() {
        Notification message = Notification.builder()
                .id("message_m1")
                .kind(NotificationKind.MESSAGE_RECEIVED)
                .title("New Message")
                .body("You have a new message about Desk")
                .recipientId("user-1")
                .payload(NotificationPayload.forMessage("m1", "c1", "seller-1", "Desk"))
                .build();
        server.expect(requestTo(BASE_URL + "/api/notifications"))
                .andExpect(jsonPath("$.type").value("new_message"))
                .andExpect(jsonPath("$.sender_id").value("seller-1"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(creator.persist(message)).isNull();
        server.verify();
    }

    @Test
    @DisplayName("wraps API failures")
    void wrapsFailures() {
        server.expect(requestTo(BASE_URL + "/api/notifications")).andRespond(withServerError());

        assertThatThrownBy(() -> creator.persist(statusChange("shipped")))
                .isInstanceOf(NotificationPersistenceException.class)
                .hasMessageContaining("order_o1_status_shipped");
    }
}
