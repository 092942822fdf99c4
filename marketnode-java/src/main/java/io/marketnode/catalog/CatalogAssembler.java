package io.marketnode.catalog;

import io.marketnode.catalog.model.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Filters and orders resolved listings. Stateless apart from its options.
 */
public class CatalogAssembler {

    private static final Logger log = LoggerFactory.getLogger(CatalogAssembler.class);

    private static final Comparator<Listing> BY_DATE = Comparator.comparing(l -> parseTimestamp(l.date()));
    private static final Comparator<Listing> BY_NAME =
        Comparator.comparing(l -> l.productName().toLowerCase(Locale.ROOT));
    private static final Comparator<Listing> BY_PRICE = Comparator.comparingDouble(Listing::price);

    private final CatalogOptions options;

    public CatalogAssembler() {
        this(CatalogOptions.defaults());
    }

    public CatalogAssembler(CatalogOptions options) {
        this.options = options;
    }

    /**
     * True when the listing's category or any subcategory is the restricted one.
     */
    public boolean isRestricted(Listing listing) {
        return listing.categories().contains(options.restrictedCategory);
    }

    public List<Listing> filterRestricted(List<Listing> listings) {
        List<Listing> kept = new ArrayList<>(listings.size());
        for (Listing listing : listings) {
            if (isRestricted(listing)) {
                log.debug("Hiding listing {} in restricted category {}", listing.listingId(), options.restrictedCategory);
            } else {
                kept.add(listing);
            }
        }
        return kept;
    }

    /**
     * Sort into a new list. Equal elements keep their input order.
     */
    public List<Listing> sort(List<Listing> listings, SortOrder order) {
        List<Listing> sorted = new ArrayList<>(listings);
        if (order == SortOrder.NONE || order.isReserved()) {
            return sorted;
        }
        Comparator<Listing> comparator = switch (order) {
            case MOST_RECENT -> BY_DATE.reversed();
            case OLDEST -> BY_DATE;
            case ALPHABETICAL -> BY_NAME;
            case PRICE_LOWEST -> BY_PRICE;
            case PRICE_HIGHEST -> BY_PRICE.reversed();
            default -> throw new IllegalArgumentException("Unsupported sort order " + order);
        };
        sorted.sort(comparator);
        return sorted;
    }

    /**
     * Filter, sort, then truncate.
     * @param limit Maximum number of listings; 0 or less means unlimited
     */
    public List<Listing> assemble(List<Listing> listings, SortOrder order, boolean hideRestricted, int limit) {
        List<Listing> result = hideRestricted ? filterRestricted(listings) : new ArrayList<>(listings);
        result = sort(result, order);
        if (limit > 0 && result.size() > limit) {
            result = new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    /**
     * Parse an ISO-8601 timestamp. A trailing {@code Z} is read as {@code +00:00},
     * a timestamp without offset as UTC.
     * @return The instant, or {@link Instant#MIN} when the text cannot be parsed
     */
    static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Instant.MIN;
        }
        String normalized = text.trim();
        if (normalized.endsWith("Z") || normalized.endsWith("z")) {
            normalized = normalized.substring(0, normalized.length() - 1) + "+00:00";
        }
        try {
            return OffsetDateTime.parse(normalized).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable listing date '{}'", text);
                return Instant.MIN;
            }
        }
    }

    public CatalogOptions getOptions() {
        return options;
    }
}
