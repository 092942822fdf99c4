package io.marketnode.catalog;

import java.time.Duration;

/**
 * Settings shared by the resolver, assembler and service.
 */
public class CatalogOptions {
    public static final String DEFAULT_RESTRICTED_CATEGORY = "Illicit";
    public static final int DEFAULT_MAX_SEARCH_RESULTS = 1000;

    public final String restrictedCategory;
    public final int maxSearchResults;
    public final int concurrency;
    public final Duration fetchTimeout;

    private CatalogOptions(Builder builder) {
        if (builder.restrictedCategory == null || builder.restrictedCategory.isEmpty()) {
            throw new IllegalArgumentException("restrictedCategory must not be empty");
        }
        if (builder.maxSearchResults < 0) {
            throw new IllegalArgumentException("maxSearchResults must not be negative");
        }
        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (builder.fetchTimeout == null || builder.fetchTimeout.isNegative() || builder.fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive");
        }
        this.restrictedCategory = builder.restrictedCategory;
        this.maxSearchResults = builder.maxSearchResults;
        this.concurrency = builder.concurrency;
        this.fetchTimeout = builder.fetchTimeout;
    }

    public static CatalogOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String restrictedCategory() { return restrictedCategory; }
    public int maxSearchResults() { return maxSearchResults; }
    public int concurrency() { return concurrency; }
    public Duration fetchTimeout() { return fetchTimeout; }

    public static class Builder {
        private String restrictedCategory = DEFAULT_RESTRICTED_CATEGORY;
        private int maxSearchResults = DEFAULT_MAX_SEARCH_RESULTS;
        private int concurrency = Runtime.getRuntime().availableProcessors();
        private Duration fetchTimeout = Duration.ofSeconds(10);

        public Builder restrictedCategory(String category) { this.restrictedCategory = category; return this; }
        public Builder maxSearchResults(int max) { this.maxSearchResults = max; return this; }
        public Builder concurrency(int concurrency) { this.concurrency = concurrency; return this; }
        public Builder fetchTimeout(Duration timeout) { this.fetchTimeout = timeout; return this; }

        public CatalogOptions build() {
            return new CatalogOptions(this);
        }
    }
}
