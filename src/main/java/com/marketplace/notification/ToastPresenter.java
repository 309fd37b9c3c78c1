package com.marketplace.notification;

/**
 * Fire-and-forget presentation of a transient toast. Styling is derived from the kind.
 */
@FunctionalInterface
public interface ToastPresenter {

    void show(NotificationKind kind, String title, String body);
}
