package com.marketplace.unit.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketplace.exception.ChangeEventSourceException;
import com.marketplace.realtime.ChangeEventCallbacks;
import com.marketplace.realtime.ChangeOperation;
import com.marketplace.realtime.EntityType;
import com.marketplace.realtime.MarketplaceStreams;
import com.marketplace.realtime.RawChangeEvent;
import com.marketplace.realtime.SourceSubscription;
import com.marketplace.realtime.StreamDeclaration;
import com.marketplace.source.ActiveSubscription;
import com.marketplace.source.ConnectMode;
import com.marketplace.source.InMemoryChangeEventSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryChangeEventSourceTest {

    private InMemoryChangeEventSource source;

    @BeforeEach
    void setUp() {
        source = new InMemoryChangeEventSource();
    }

    /** Records every callback as a short string. */
    private static final class Probe implements ChangeEventCallbacks {

        private final List<String> calls = new ArrayList<>();

        @Override
        public void onConnected() {
            calls.add("connected");
        }

        @Override
        public void onEvent(RawChangeEvent event) {
            calls.add("event:" + event.currentRow().get("id"));
        }

        @Override
        public void onError(Throwable cause) {
            calls.add("error");
        }

        @Override
        public void onClosed() {
            calls.add("closed");
        }
    }

    private SourceSubscription subscribe(StreamDeclaration declaration, String userId, Probe probe) {
        return source.subscribe(declaration.getId(), declaration, declaration.filterFor(userId), probe);
    }

    private static RawChangeEvent order(ChangeOperation operation, String id, String buyerId) {
        return RawChangeEvent.builder()
                .entity(EntityType.ORDER)
                .operation(operation)
                .after(Map.of("id", id, "buyer_id", buyerId, "seller_id", "seller-9"))
                .build();
    }

    @Nested
    @DisplayName("Connect modes")
    class ConnectModes {

        @Test
        @DisplayName("CONFIRM reports connected from within subscribe")
        void confirmConnectsImmediately() {
            Probe probe = new Probe();

            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", probe);

            assertThat(probe.calls).containsExactly("connected");
        }

        @Test
        @DisplayName("HANG leaves the subscription pending until confirmed")
        void hangUntilConfirmed() {
            source.setConnectMode(ConnectMode.HANG);
            Probe probe = new Probe();
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", probe);

            assertThat(probe.calls).isEmpty();
            assertThat(source.activeSubscriptions()).extracting(ActiveSubscription::confirmed).containsExactly(false);

            assertThat(source.confirmPending()).isEqualTo(1);
            assertThat(probe.calls).containsExactly("connected");
            assertThat(source.confirmPending()).isZero();
        }

        @Test
        @DisplayName("REJECT refuses the subscription")
        void rejectThrows() {
            source.setConnectMode(ConnectMode.REJECT);

            assertThatThrownBy(() -> subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", new Probe()))
                    .isInstanceOf(ChangeEventSourceException.class);
            assertThat(source.activeSubscriptions()).isEmpty();
        }
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("delivers only to subscriptions whose filter matches")
        void filtersByUser() {
            Probe mine = new Probe();
            Probe other = new Probe();
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", mine);
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u2", other);

            int delivered = source.publish(order(ChangeOperation.CREATED, "o1", "u1"));

            assertThat(delivered).isEqualTo(1);
            assertThat(mine.calls).containsExactly("connected", "event:o1");
            assertThat(other.calls).containsExactly("connected");
        }

        @Test
        @DisplayName("respects the stream's entity and operations")
        void filtersByEntityAndOperation() {
            Probe messages = new Probe();
            subscribe(MarketplaceStreams.MESSAGES_INBOUND, "u1", messages);

            source.publish(order(ChangeOperation.CREATED, "o1", "u1"));
            source.publish(RawChangeEvent.builder()
                    .entity(EntityType.MESSAGE)
                    .operation(ChangeOperation.UPDATED)
                    .after(Map.of("id", "m1", "recipient_id", "u1"))
                    .build());

            assertThat(messages.calls).containsExactly("connected");
        }

        @Test
        @DisplayName("never delivers to a cancelled subscription")
        void cancelledSkipped() {
            Probe probe = new Probe();
            SourceSubscription subscription = subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", probe);

            subscription.cancel();
            subscription.cancel();

            assertThat(source.publish(order(ChangeOperation.CREATED, "o1", "u1"))).isZero();
            assertThat(source.activeSubscriptions()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failure injection")
    class FailureInjection {

        @Test
        @DisplayName("failStream errors and drops only the matching subscriptions")
        void failStream() {
            Probe u1 = new Probe();
            Probe u2 = new Probe();
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", u1);
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u2", u2);

            assertThat(source.failStream("orders-as-buyer", "u1")).isEqualTo(1);

            assertThat(u1.calls).containsExactly("connected", "error");
            assertThat(u2.calls).containsExactly("connected");
            assertThat(source.activeSubscriptions()).hasSize(1);
        }

        @Test
        @DisplayName("closeStream without a filter value closes every subscription of the stream")
        void closeStream() {
            Probe u1 = new Probe();
            Probe u2 = new Probe();
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u1", u1);
            subscribe(MarketplaceStreams.ORDERS_AS_BUYER, "u2", u2);

            assertThat(source.closeStream("orders-as-buyer", null)).isEqualTo(2);

            assertThat(u1.calls).containsExactly("connected", "closed");
            assertThat(u2.calls).containsExactly("connected", "closed");
            assertThat(source.activeSubscriptions()).isEmpty();
        }

        @Test
        @DisplayName("unknown streams terminate nothing")
        void unknownStream() {
            assertThat(source.failStream("nope", null)).isZero();
        }
    }
}
