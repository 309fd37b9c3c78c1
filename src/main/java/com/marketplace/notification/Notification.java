package com.marketplace.notification;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A typed, user-facing notification.
 *
 * <p>The id is deterministic: the same logical change re-delivered by the transport yields
 * the same id, which is what the store deduplicates on. Instances are immutable; marking
 * one read produces a copy via {@link #withRead(boolean)}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Notification {

    private final String id;
    private final NotificationKind kind;
    private final String title;
    private final String body;
    private final NotificationPayload payload;

    /** User the notification was produced for. */
    private final String recipientId;

    private final Instant createdAt;
    private final boolean read;

    public Notification withRead(boolean read) {
        return this.read == read ? this : toBuilder().read(read).build();
    }
}
