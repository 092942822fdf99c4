package io.marketnode.catalog;

/**
 * Listing orderings. The ordinal is the wire code used by clients.
 * CATEGORY, AVERAGE_RATING, MOST_FAVORITED and MOST_SALES are reserved and keep the input order.
 */
public enum SortOrder {
    NONE,
    CATEGORY,
    MOST_RECENT,
    OLDEST,
    ALPHABETICAL,
    PRICE_LOWEST,
    PRICE_HIGHEST,
    AVERAGE_RATING,
    MOST_FAVORITED,
    MOST_SALES;

    public static SortOrder fromOrdinal(int code) {
        SortOrder[] orders = values();
        return code >= 0 && code < orders.length ? orders[code] : NONE;
    }

    public boolean isReserved() {
        return this == CATEGORY || this == AVERAGE_RATING || this == MOST_FAVORITED || this == MOST_SALES;
    }
}
