package com.marketplace.realtime;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Schema tag of a change event. The table name is what the change stream reports
 * and what stream declarations subscribe to.
 */
@Getter
@RequiredArgsConstructor
public enum EntityType {
    ORDER("marketplace_orders"),
    MESSAGE("marketplace_messages"),
    ANALYTICS("product_analytics");

    private final String table;

    public static EntityType fromTable(String table) {
        for (EntityType type : values()) {
            if (type.table.equals(table)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change-stream table: " + table);
    }
}
