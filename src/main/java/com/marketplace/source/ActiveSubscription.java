package com.marketplace.source;

import com.marketplace.realtime.SubscriptionFilter;

/**
 * Read-only view of one live subscription held by the in-memory source.
 */
public record ActiveSubscription(long id, String streamId, SubscriptionFilter filter, boolean confirmed) {}
