package com.marketplace.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketplace.notification.Notification;
import com.marketplace.notification.NotificationKind;
import com.marketplace.notification.NotificationStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NotificationStoreTest {

    private final List<String> toasts = new ArrayList<>();
    private NotificationStore store;

    @BeforeEach
    void setUp() {
        store = new NotificationStore(3, (kind, title, body) -> toasts.add(kind + ":" + title));
    }

    private static Notification notification(String id) {
        return Notification.builder()
                .id(id)
                .kind(NotificationKind.ORDER_CREATED)
                .title("Order Placed")
                .body("Your order for product has been placed successfully")
                .recipientId("user-1")
                .createdAt(Instant.parse("2025-03-01T10:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("insert")
    class Insert {

        @Test
        @DisplayName("lists newest first")
        void newestFirst() {
            store.insert(notification("a"));
            store.insert(notification("b"));

            assertThat(store.list()).extracting(Notification::getId).containsExactly("b", "a");
        }

        @Test
        @DisplayName("evicts the oldest beyond capacity")
        void evictsOldest() {
            IntStream.rangeClosed(1, 5).forEach(i -> store.insert(notification("n" + i)));

            assertThat(store.size()).isEqualTo(3);
            assertThat(store.list()).extracting(Notification::getId).containsExactly("n5", "n4", "n3");
            assertThat(store.find("n1")).isEmpty();
        }

        @Test
        @DisplayName("ignores a duplicate id without notifying anyone")
        void duplicateIgnored() {
            List<Notification> seen = new ArrayList<>();
            store.subscribe(seen::add);

            assertThat(store.insert(notification("a"))).isTrue();
            assertThat(store.insert(notification("a"))).isFalse();

            assertThat(store.size()).isEqualTo(1);
            assertThat(seen).hasSize(1);
            assertThat(toasts).hasSize(1);
        }

        @Test
        @DisplayName("a duplicate does not revive a read entry")
        void duplicateKeepsReadFlag() {
            store.insert(notification("a"));
            store.markRead("a");

            store.insert(notification("a"));

            assertThat(store.find("a")).get().extracting(Notification::isRead).isEqualTo(true);
        }

        @Test
        @DisplayName("shows a toast for every insert")
        void showsToast() {
            store.insert(notification("a"));

            assertThat(toasts).containsExactly("ORDER_CREATED:Order Placed");
        }

        @Test
        @DisplayName("works without a toast presenter")
        void noPresenter() {
            NotificationStore silent = new NotificationStore(5, null);

            assertThat(silent.insert(notification("a"))).isTrue();
        }
    }

    @Nested
    @DisplayName("Observers")
    class Observers {

        @Test
        @DisplayName("each observer is told exactly once per insert")
        void fanOutOnce() {
            List<String> first = new ArrayList<>();
            List<String> second = new ArrayList<>();
            store.subscribe(n -> first.add(n.getId()));
            store.subscribe(n -> second.add(n.getId()));

            store.insert(notification("a"));

            assertThat(first).containsExactly("a");
            assertThat(second).containsExactly("a");
        }

        @Test
        @DisplayName("a failing observer does not stop the others")
        void failingObserverIsolated() {
            List<String> seen = new ArrayList<>();
            store.subscribe(n -> {
                throw new IllegalStateException("observer failed");
            });
            store.subscribe(n -> seen.add(n.getId()));

            assertThat(store.insert(notification("a"))).isTrue();
            assertThat(seen).containsExactly("a");
            assertThat(toasts).hasSize(1);
        }

        @Test
        @DisplayName("an observer may unsubscribe itself during fan-out")
        void unsubscribeDuringFanOut() {
            List<String> seen = new ArrayList<>();
            AtomicReference<Runnable> unsubscribe = new AtomicReference<>();
            unsubscribe.set(store.subscribe(n -> {
                seen.add(n.getId());
                unsubscribe.get().run();
            }));

            store.insert(notification("a"));
            store.insert(notification("b"));

            assertThat(seen).containsExactly("a");
            assertThat(store.observerCount()).isZero();
        }

        @Test
        @DisplayName("an observer may read the store during fan-out")
        void readDuringFanOut() {
            List<Integer> sizes = new ArrayList<>();
            store.subscribe(n -> sizes.add(store.size()));

            store.insert(notification("a"));

            assertThat(sizes).containsExactly(1);
        }

        @Test
        @DisplayName("unsubscribing twice is harmless")
        void unsubscribeTwice() {
            Runnable unsubscribe = store.subscribe(n -> {});

            unsubscribe.run();
            unsubscribe.run();

            assertThat(store.observerCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Read state")
    class ReadState {

        @Test
        @DisplayName("markRead flips one entry and lowers the unread count")
        void markRead() {
            store.insert(notification("a"));
            store.insert(notification("b"));

            assertThat(store.markRead("a")).isTrue();
            assertThat(store.markRead("a")).isFalse();

            assertThat(store.unreadCount()).isEqualTo(1);
            assertThat(store.listUnread()).extracting(Notification::getId).containsExactly("b");
        }

        @Test
        @DisplayName("markRead of an unknown id is a no-op")
        void markReadUnknown() {
            assertThat(store.markRead("missing")).isFalse();
        }

        @Test
        @DisplayName("markAllRead returns how many changed")
        void markAllRead() {
            store.insert(notification("a"));
            store.insert(notification("b"));
            store.markRead("a");

            assertThat(store.markAllRead()).isEqualTo(1);
            assertThat(store.unreadCount()).isZero();
        }

        @Test
        @DisplayName("clear empties the store but keeps observers")
        void clear() {
            List<String> seen = new ArrayList<>();
            store.subscribe(n -> seen.add(n.getId()));
            store.insert(notification("a"));

            store.clear();
            store.insert(notification("a"));

            assertThat(store.size()).isEqualTo(1);
            assertThat(seen).containsExactly("a", "a");
        }
    }

    @Test
    @DisplayName("rejects a non-positive capacity")
    void rejectsBadCapacity() {
        assertThatThrownBy(() -> new NotificationStore(0, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
