package com.marketplace.realtime;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One row-level change pushed by the change stream.
 *
 * <p>Snapshots are column-name to value maps exactly as the transport delivers them.
 * UPDATED carries both {@code before} and {@code after}, CREATED only {@code after},
 * DELETED only {@code before}. The shape is not enforced here: events come from the
 * wire and malformed ones are rejected by the translator, one event at a time.
 *
 * <p>Consumed immediately by the stream's listener and never stored.
 */
@Getter
@Builder
@ToString
public class RawChangeEvent {

    private final EntityType entity;
    private final ChangeOperation operation;
    private final Map<String, Object> before;
    private final Map<String, Object> after;

    @Builder.Default
    private final Instant receivedAt = Instant.now();

    public boolean hasBefore() {
        return before != null;
    }

    public boolean hasAfter() {
        return after != null;
    }

    /**
     * The snapshot that identifies the row: {@code after} when present, otherwise {@code before}.
     */
    public Map<String, Object> currentRow() {
        if (after != null) {
            return after;
        }
        return before != null ? before : Collections.emptyMap();
    }
}
