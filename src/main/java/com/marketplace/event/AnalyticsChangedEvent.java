package com.marketplace.event;

import com.marketplace.realtime.ChangeOperation;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a product analytics row of a seller changes, so the seller's dashboard
 * can refetch its metrics.
 */
public class AnalyticsChangedEvent extends ApplicationEvent {

    private final String sellerId;
    private final String productId;
    private final ChangeOperation operation;

    public AnalyticsChangedEvent(Object source, String sellerId, String productId, ChangeOperation operation) {
        super(source);
        this.sellerId = sellerId;
        this.productId = productId;
        this.operation = operation;
    }

    public String getSellerId() {
        return sellerId;
    }

    public String getProductId() {
        return productId;
    }

    public ChangeOperation getOperation() {
        return operation;
    }
}
