package io.marketnode.catalog.model;

import java.util.Optional;

/**
 * Logical document types. The tag is the value of a remote document's
 * {@code metadata} field and of the index's content column.
 */
public enum ContentType {
    LISTING("listing", Listing.class),
    USER("user", User.class),
    PRODUCT_RATING("product_rating", ProductRating.class),
    SELLER_RATING("seller_rating", SellerRating.class);

    private final String tag;
    private final Class<? extends TypedView> viewType;

    ContentType(String tag, Class<? extends TypedView> viewType) {
        this.tag = tag;
        this.viewType = viewType;
    }

    public String tag() {
        return tag;
    }

    /**
     * View class documents of this type are projected into.
     */
    public Class<? extends TypedView> viewType() {
        return viewType;
    }

    public static Optional<ContentType> fromTag(String tag) {
        for (ContentType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
