package com.marketplace.translation;

/**
 * Side of the trade the observing user is on for a given order.
 */
public enum OrderRole {
    BUYER,
    SELLER
}
