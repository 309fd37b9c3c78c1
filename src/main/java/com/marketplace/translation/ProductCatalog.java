package com.marketplace.translation;

import java.util.Optional;

/**
 * Looks up display data for products referenced by change events.
 */
public interface ProductCatalog {

    /**
     * Returns the product's title, or empty when the product is unknown or the lookup
     * failed. Implementations must not throw for lookup failures.
     */
    Optional<String> findTitle(String productId);
}
