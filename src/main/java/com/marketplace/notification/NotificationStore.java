package com.marketplace.notification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, newest-first history of a session's notifications.
 *
 * <p>Invariants:
 * <ul>
 *   <li>At most {@code capacity} entries; inserting beyond it evicts the oldest.</li>
 *   <li>Ids are unique. Inserting an id that is already present does nothing, so a
 *       re-delivered change event is neither stored nor announced twice.</li>
 * </ul>
 *
 * <p>Every successful insert is fanned out to each registered {@link NotificationObserver}
 * exactly once and shown through the {@link ToastPresenter}. Fan-out runs outside the store
 * lock over a copy-on-write observer list, so observers may unsubscribe (or read the store)
 * from inside their callback. A failing observer is logged and skipped.
 */
public class NotificationStore {

    private static final Logger log = LoggerFactory.getLogger(NotificationStore.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final Object lock = new Object();
    private final int capacity;
    private final ToastPresenter toastPresenter;

    /** Insertion order: oldest first. */
    private final LinkedHashMap<String, Notification> entries = new LinkedHashMap<>();

    private final List<NotificationObserver> observers = new CopyOnWriteArrayList<>();

    public NotificationStore(int capacity, ToastPresenter toastPresenter) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.toastPresenter = toastPresenter;
    }

    /**
     * Inserts the notification unless one with the same id is already stored.
     *
     * @return true if inserted (and fanned out), false for a duplicate
     */
    public boolean insert(Notification notification) {
        synchronized (lock) {
            if (entries.containsKey(notification.getId())) {
                log.debug("Notification {} already stored, ignoring", notification.getId());
                return false;
            }
            entries.put(notification.getId(), notification);
            evictOverflow();
        }

        fanOut(notification);
        showToast(notification);
        return true;
    }

    /**
     * Marks the entry read. Unknown ids are ignored: the entry may have just been evicted.
     *
     * @return true if an entry changed
     */
    public boolean markRead(String id) {
        synchronized (lock) {
            Notification existing = entries.get(id);
            if (existing == null || existing.isRead()) {
                return false;
            }
            entries.put(id, existing.withRead(true));
            return true;
        }
    }

    /**
     * @return the number of entries that changed
     */
    public int markAllRead() {
        synchronized (lock) {
            int changed = 0;
            for (Map.Entry<String, Notification> entry : entries.entrySet()) {
                if (!entry.getValue().isRead()) {
                    entry.setValue(entry.getValue().withRead(true));
                    changed++;
                }
            }
            return changed;
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    /**
     * Registers an observer for subsequent inserts.
     *
     * @return unsubscribes the observer; safe to call repeatedly and during fan-out
     */
    public Runnable subscribe(NotificationObserver observer) {
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    /** Newest first. */
    public List<Notification> list() {
        synchronized (lock) {
            List<Notification> snapshot = new ArrayList<>(entries.values());
            Collections.reverse(snapshot);
            return snapshot;
        }
    }

    public List<Notification> listUnread() {
        return list().stream().filter(n -> !n.isRead()).toList();
    }

    public Optional<Notification> find(String id) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(id));
        }
    }

    public int unreadCount() {
        synchronized (lock) {
            return (int) entries.values().stream().filter(n -> !n.isRead()).count();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int observerCount() {
        return observers.size();
    }

    private void evictOverflow() {
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > capacity && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Evicted notification {} (capacity {})", evicted, capacity);
        }
    }

    private void fanOut(Notification notification) {
        for (NotificationObserver observer : observers) {
            try {
                observer.onNotification(notification);
            } catch (RuntimeException e) {
                log.error("Notification observer failed for {}: {}", notification.getId(), e.getMessage(), e);
            }
        }
    }

    private void showToast(Notification notification) {
        if (toastPresenter == null) {
            return;
        }
        try {
            toastPresenter.show(notification.getKind(), notification.getTitle(), notification.getBody());
        } catch (RuntimeException e) {
            log.warn("Toast for {} failed: {}", notification.getId(), e.getMessage());
        }
    }
}
