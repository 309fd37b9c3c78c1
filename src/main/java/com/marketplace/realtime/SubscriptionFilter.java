package com.marketplace.realtime;

import java.util.Map;
import java.util.Objects;

/**
 * Subscriber-identity predicate scoping a stream: {@code field = value}.
 * Rendered in the change-stream filter syntax, e.g. {@code buyer_id=eq.user-1}.
 */
public record SubscriptionFilter(String field, String value) {

    public SubscriptionFilter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    public boolean matches(Map<String, Object> row) {
        if (row == null) {
            return false;
        }
        Object column = row.get(field);
        return column != null && value.equals(String.valueOf(column));
    }

    @Override
    public String toString() {
        return field + "=eq." + value;
    }
}
