package com.marketplace.event;

import com.marketplace.notification.NotificationKind;
import org.springframework.context.ApplicationEvent;

/**
 * A transient toast for one user. Not stored anywhere; pushed once and forgotten.
 */
public class ToastEvent extends ApplicationEvent {

    private final String userId;
    private final NotificationKind kind;
    private final String title;
    private final String body;

    public ToastEvent(Object source, String userId, NotificationKind kind, String title, String body) {
        super(source);
        this.userId = userId;
        this.kind = kind;
        this.title = title;
        this.body = body;
    }

    public String getUserId() {
        return userId;
    }

    public NotificationKind getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }
}
