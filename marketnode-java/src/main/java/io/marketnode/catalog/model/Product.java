package io.marketnode.catalog.model;

import java.util.List;
import java.util.Optional;

/**
 * Product section of a listing.
 *
 * @param categories Primary category first, then subcategories
 */
public record Product(
    String name,
    String description,
    List<String> categories,
    Optional<Double> weight,
    List<ImageRef> images,
    Optional<String> thumbnail
) {
    public Product {
        categories = List.copyOf(categories);
        images = List.copyOf(images);
    }

    public String category() {
        return categories.get(0);
    }

    public List<String> subcategories() {
        return categories.subList(1, categories.size());
    }
}
