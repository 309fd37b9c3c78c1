package com.marketplace.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.marketplace.config.RealtimeConfig;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Product lookups against {@code GET /api/marketplace/products/{id}}.
 *
 * <p>Titles are cached in Caffeine per product id. Unknown products (404) are cached as
 * empty so a deleted product does not cost one request per event; other failures are
 * not cached and fall back to empty, leaving the translator to use its generic label.
 */
@Component
public class RestProductCatalog implements ProductCatalog {

    private static final Logger log = LoggerFactory.getLogger(RestProductCatalog.class);

    private final RestClient restClient;

    /** Caffeine cache: key = product id, value = title (empty for unknown products). */
    private final Cache<String, Optional<String>> titleCache;

    public RestProductCatalog(
            @Qualifier("marketplaceApiRestClient") RestClient restClient, RealtimeConfig realtimeConfig) {
        this.restClient = restClient;
        this.titleCache = Caffeine.newBuilder()
                .expireAfterWrite(realtimeConfig.getCatalog().getCacheTtl())
                .maximumSize(realtimeConfig.getCatalog().getCacheMaxSize())
                .build();
    }

    @Override
    public Optional<String> findTitle(String productId) {
        if (productId == null || productId.isBlank()) {
            return Optional.empty();
        }
        Optional<String> cached = titleCache.getIfPresent(productId);
        if (cached != null) {
            return cached;
        }

        try {
            ProductEnvelope envelope = restClient
                    .get()
                    .uri("/api/marketplace/products/{id}", productId)
                    .retrieve()
                    .body(ProductEnvelope.class);
            Optional<String> title = Optional.ofNullable(envelope)
                    .map(ProductEnvelope::product)
                    .map(ProductSummary::title)
                    .filter(t -> !t.isBlank());
            titleCache.put(productId, title);
            return title;
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Product {} not found", productId);
            titleCache.put(productId, Optional.empty());
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("Product lookup for {} failed: {}", productId, e.getMessage());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProductEnvelope(ProductSummary product) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProductSummary(String id, String title) {}
}
