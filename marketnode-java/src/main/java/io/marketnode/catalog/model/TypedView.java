package io.marketnode.catalog.model;

/**
 * Validated, strongly-shaped projection of a remote document.
 */
public interface TypedView {

    /**
     * Remote key the document was fetched from.
     */
    String key();

    ContentType contentType();
}
