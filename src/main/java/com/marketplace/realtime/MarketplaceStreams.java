package com.marketplace.realtime;

import java.util.List;

/**
 * Catalog of the streams a marketplace session can hold.
 *
 * <p>Orders are watched from both sides of the trade because the change stream filters on a
 * single column. A user who is buyer and seller of the same order receives the event on
 * both streams; notification ids collapse the pair into one entry.
 */
public final class MarketplaceStreams {

    public static final StreamDeclaration ORDERS_AS_BUYER = StreamDeclaration.builder()
            .id("orders-as-buyer")
            .entity(EntityType.ORDER)
            .filterField("buyer_id")
            .build();

    public static final StreamDeclaration ORDERS_AS_SELLER = StreamDeclaration.builder()
            .id("orders-as-seller")
            .entity(EntityType.ORDER)
            .filterField("seller_id")
            .build();

    public static final StreamDeclaration MESSAGES_INBOUND = StreamDeclaration.builder()
            .id("messages-inbound")
            .entity(EntityType.MESSAGE)
            .filterField("recipient_id")
            .operation(ChangeOperation.CREATED)
            .build();

    public static final StreamDeclaration ANALYTICS_AS_SELLER = StreamDeclaration.builder()
            .id("analytics-as-seller")
            .entity(EntityType.ANALYTICS)
            .filterField("seller_id")
            .build();

    private MarketplaceStreams() {}

    /** Streams feeding the notification pipeline. */
    public static List<StreamDeclaration> notificationStreams() {
        return List.of(ORDERS_AS_BUYER, ORDERS_AS_SELLER, MESSAGES_INBOUND);
    }
}
