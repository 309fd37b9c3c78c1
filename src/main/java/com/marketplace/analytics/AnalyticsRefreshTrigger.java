package com.marketplace.analytics;

import com.marketplace.event.EventPublisherHelper;
import com.marketplace.realtime.ChangeEventListener;
import com.marketplace.realtime.RawChangeEvent;
import com.marketplace.realtime.StreamDeclaration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Consumes the product analytics stream. Analytics rows are not notification-worthy;
 * any change simply tells the seller's dashboard to refetch its metrics.
 */
@Component
public class AnalyticsRefreshTrigger implements ChangeEventListener {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsRefreshTrigger.class);

    private final EventPublisherHelper eventPublisherHelper;

    public AnalyticsRefreshTrigger(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void onChangeEvent(StreamDeclaration stream, RawChangeEvent event) {
        Map<String, Object> row = event.currentRow();
        Object sellerId = row.get("seller_id");
        if (sellerId == null) {
            log.warn("Analytics change on {} without seller_id, ignoring", stream.getId());
            return;
        }
        Object productId = row.get("product_id");

        log.debug("Analytics changed for seller {} (product {})", sellerId, productId);
        eventPublisherHelper.publishAnalyticsChanged(
                this, String.valueOf(sellerId), productId != null ? String.valueOf(productId) : null,
                event.getOperation());
    }
}
