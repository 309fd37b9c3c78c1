package com.marketplace.translation;

import com.marketplace.exception.TranslationException;
import com.marketplace.realtime.RawChangeEvent;
import java.util.Map;
import java.util.Objects;

/**
 * Typed read access to one snapshot (before or after) of a raw change event.
 *
 * <p>Required columns throw {@link TranslationException}; optional columns return null.
 * Values are rendered with {@link String#valueOf(Object)} so numeric ids and string ids
 * compare the same way the subscription filter does.
 */
final class RowSnapshot {

    private final RawChangeEvent event;
    private final String side;
    private final Map<String, Object> row;

    private RowSnapshot(RawChangeEvent event, String side, Map<String, Object> row) {
        this.event = event;
        this.side = side;
        this.row = row;
    }

    static RowSnapshot after(RawChangeEvent event) {
        if (!event.hasAfter()) {
            throw malformed(event, "after", null, "missing 'after' snapshot");
        }
        return new RowSnapshot(event, "after", event.getAfter());
    }

    static RowSnapshot before(RawChangeEvent event) {
        if (!event.hasBefore()) {
            throw malformed(event, "before", null, "missing 'before' snapshot");
        }
        return new RowSnapshot(event, "before", event.getBefore());
    }

    String require(String column) {
        String value = optional(column);
        if (value == null || value.isBlank()) {
            throw malformed(event, side, column, "missing required column '" + column + "'");
        }
        return value;
    }

    String optional(String column) {
        Object value = row.get(column);
        return value != null ? String.valueOf(value) : null;
    }

    /** Nested JSON object column; null when absent or not an object. */
    @SuppressWarnings("unchecked")
    Map<String, Object> object(String column) {
        Object value = row.get(column);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    boolean differs(RowSnapshot other, String column) {
        return !Objects.equals(optional(column), other.optional(column));
    }

    private static TranslationException malformed(RawChangeEvent event, String side, String column, String reason) {
        Map<String, Object> details = column != null
                ? Map.of("entity", String.valueOf(event.getEntity()), "operation",
                        String.valueOf(event.getOperation()), "snapshot", side, "column", column)
                : Map.of("entity", String.valueOf(event.getEntity()), "operation",
                        String.valueOf(event.getOperation()), "snapshot", side);
        return new TranslationException(
                "Malformed " + event.getEntity() + " " + event.getOperation() + " event: " + reason, details);
    }
}
