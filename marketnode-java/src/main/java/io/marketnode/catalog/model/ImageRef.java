package io.marketnode.catalog.model;

/**
 * Reference to a product image attachment by content name and position.
 */
public record ImageRef(String name, int id) {}
