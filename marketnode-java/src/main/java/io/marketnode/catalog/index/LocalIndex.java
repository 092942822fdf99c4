package io.marketnode.catalog.index;

import io.marketnode.catalog.model.ContentType;

import java.util.List;
import java.util.Optional;

/**
 * Read path of the local secondary index mapping search terms to remote keys.
 * The catalog core never writes through this interface.
 *
 * All methods throw {@link IndexUnavailableException} when the underlying
 * store cannot be queried.
 */
public interface LocalIndex {

    /**
     * Keys of all entries matching the query.
     * Each key appears once, in the order it was first seen; the query's limit
     * applies to distinct keys.
     * @param query Entry predicate
     * @return Distinct keys
     */
    List<String> keys(IndexQuery query);

    /**
     * Keys indexed under exactly this search term.
     */
    default List<String> lookup(String searchTerm, ContentType contentType) {
        return keys(IndexQuery.exact(searchTerm, contentType));
    }

    /**
     * First key indexed under exactly this search term.
     */
    default Optional<String> lookupExact(String searchTerm, ContentType contentType) {
        return keys(IndexQuery.exact(searchTerm, contentType).withLimit(1)).stream().findFirst();
    }

    /**
     * Number of distinct keys matching the query.
     */
    default int count(IndexQuery query) {
        return keys(query).size();
    }
}
