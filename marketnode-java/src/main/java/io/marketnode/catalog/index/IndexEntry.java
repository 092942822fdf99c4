package io.marketnode.catalog.index;

import io.marketnode.catalog.model.ContentType;

import java.util.Objects;

/**
 * One row of the local secondary index: a search term pointing at a remote key.
 */
public record IndexEntry(String searchTerm, ContentType contentType, String key) {

    public IndexEntry {
        Objects.requireNonNull(searchTerm, "searchTerm");
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(key, "key");
    }
}
