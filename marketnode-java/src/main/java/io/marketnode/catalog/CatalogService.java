package io.marketnode.catalog;

import io.marketnode.catalog.index.IndexQuery;
import io.marketnode.catalog.model.ContentType;
import io.marketnode.catalog.model.Listing;
import io.marketnode.catalog.model.ProductRating;
import io.marketnode.catalog.model.SellerRating;
import io.marketnode.catalog.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side catalog queries used by the marketplace front ends.
 *
 * Listings are indexed under their listing id, seller id, product name and
 * categories; users under their user id; product ratings under the listing
 * id and seller ratings under the seller's user id.
 */
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CatalogResolver resolver;
    private final CatalogAssembler assembler;
    private final CatalogOptions options;
    private final Clock clock;

    public CatalogService(CatalogResolver resolver) {
        this(resolver, new CatalogAssembler(resolver.getOptions()), Clock.systemUTC());
    }

    public CatalogService(CatalogResolver resolver, CatalogAssembler assembler, Clock clock) {
        this.resolver = resolver;
        this.assembler = assembler;
        this.options = resolver.getOptions();
        this.clock = clock;
    }

    // ==================== Listings ====================

    public List<Listing> getListings(SortOrder order, boolean hideRestricted) {
        return listings(IndexQuery.all(ContentType.LISTING), order, hideRestricted, 0);
    }

    /**
     * Listings whose indexed terms match every word of the search term, by prefix.
     */
    public List<Listing> getListingsBySearchTerm(String searchTerm, boolean hideRestricted) {
        IndexQuery query = IndexQuery.matching(searchTerm, ContentType.LISTING, options.maxSearchResults);
        return listings(query, SortOrder.NONE, hideRestricted, 0);
    }

    public List<Listing> getListingsByCategory(String category, boolean hideRestricted) {
        return listings(IndexQuery.exact(category, ContentType.LISTING), SortOrder.NONE, hideRestricted, 0);
    }

    public List<Listing> getListingsByMostRecent(int limit, boolean hideRestricted) {
        return listings(IndexQuery.all(ContentType.LISTING), SortOrder.MOST_RECENT, hideRestricted, limit);
    }

    /**
     * Listings published by a seller.
     */
    public List<Listing> getInventory(String sellerId, boolean hideRestricted) {
        List<Listing> listings = resolver.resolveViews(IndexQuery.exact(sellerId, ContentType.LISTING), Listing.class)
            .stream()
            .filter(listing -> listing.sellerId().equals(sellerId))
            .toList();
        return assembler.assemble(listings, SortOrder.NONE, hideRestricted, 0);
    }

    /**
     * Quantity in stock, 0 when the listing cannot be resolved.
     */
    public int getStockAvailable(String listingId) {
        return resolver.resolveOne(listingId, ContentType.LISTING, Listing.class)
            .map(Listing::quantity)
            .orElse(0);
    }

    /**
     * Number of distinct listings indexed under the category.
     */
    public int getCategoryProductCount(String category) {
        return resolver.getLocalIndex().count(IndexQuery.exact(category, ContentType.LISTING));
    }

    private List<Listing> listings(IndexQuery query, SortOrder order, boolean hideRestricted, int limit) {
        List<Listing> resolved = resolver.resolveViews(query, Listing.class);
        List<Listing> result = assembler.assemble(resolved, order, hideRestricted, limit);
        log.debug("{} listing(s) for {} query '{}' after assembly", result.size(), query.mode(), query.term());
        return result;
    }

    // ==================== Users ====================

    public Optional<User> getUser(String userId) {
        return resolver.resolveOne(userId, ContentType.USER, User.class);
    }

    /**
     * Display name of the user, or the user id when none is set or the profile
     * cannot be fetched. A missing profile is left in the store.
     */
    public String getDisplayNameByUserId(String userId) {
        return resolver.peekOne(userId, ContentType.USER, User.class)
            .map(User::displayNameOrId)
            .orElse(userId);
    }

    /**
     * Whole days since the account was created.
     * @return Days, or -1 when the user is unknown or its creation time cannot be parsed
     */
    public long getAccountAge(String userId) {
        return getUser(userId).map(this::getAccountAge).orElse(-1L);
    }

    public long getAccountAge(User user) {
        Instant createdAt = CatalogAssembler.parseTimestamp(user.createdAt());
        if (createdAt.equals(Instant.MIN)) {
            return -1;
        }
        return Math.max(0, Duration.between(createdAt, clock.instant()).toDays());
    }

    // ==================== Ratings ====================

    public List<ProductRating> getProductRatings(String productId) {
        return resolver.resolveViews(IndexQuery.exact(productId, ContentType.PRODUCT_RATING), ProductRating.class);
    }

    public List<SellerRating> getSellerRatings(String userId) {
        return resolver.resolveViews(IndexQuery.exact(userId, ContentType.SELLER_RATING), SellerRating.class);
    }

    public int getProductStarCount(String productId, int stars) {
        return RatingStatistics.starCount(getProductRatings(productId), stars);
    }

    public double getProductAverageStars(String productId) {
        return RatingStatistics.averageStars(getProductRatings(productId));
    }

    public int getSellerReputation(String userId) {
        return RatingStatistics.reputation(getSellerRatings(userId));
    }

    public int getSellerGoodRatings(String userId) {
        return RatingStatistics.goodRatings(getSellerRatings(userId));
    }

    public int getSellerBadRatings(String userId) {
        return RatingStatistics.badRatings(getSellerRatings(userId));
    }

    public int getSellerRatingsCount(String userId) {
        return RatingStatistics.ratingsCount(getSellerRatings(userId));
    }
}
