package io.marketnode.catalog.model;

/**
 * A good (score 1) or bad (score 0) rating of a seller.
 */
public record SellerRating(
    String key,
    String raterId,
    String comments,
    String signature,
    int score
) implements TypedView {

    public static final int GOOD = 1;
    public static final int BAD = 0;

    @Override
    public ContentType contentType() {
        return ContentType.SELLER_RATING;
    }

    public boolean isGood() {
        return score == GOOD;
    }

    public boolean isBad() {
        return score == BAD;
    }
}
