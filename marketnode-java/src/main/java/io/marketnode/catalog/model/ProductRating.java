package io.marketnode.catalog.model;

import java.util.Optional;

/**
 * A 1-5 star rating of a product.
 */
public record ProductRating(
    String key,
    String raterId,
    String comments,
    String signature,
    int stars,
    Optional<String> expirationDate
) implements TypedView {

    @Override
    public ContentType contentType() {
        return ContentType.PRODUCT_RATING;
    }
}
