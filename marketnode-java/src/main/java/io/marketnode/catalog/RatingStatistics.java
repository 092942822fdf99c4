package io.marketnode.catalog;

import io.marketnode.catalog.model.ProductRating;
import io.marketnode.catalog.model.SellerRating;

import java.util.List;

/**
 * Aggregates over resolved ratings.
 */
public final class RatingStatistics {

    public static final int MIN_STARS = 1;
    public static final int MAX_STARS = 5;

    private RatingStatistics() {}

    public static int starCount(List<ProductRating> ratings) {
        return ratings.size();
    }

    /**
     * Number of ratings with exactly this many stars; out-of-range values are clamped to 1..5.
     */
    public static int starCount(List<ProductRating> ratings, int stars) {
        int wanted = Math.max(MIN_STARS, Math.min(MAX_STARS, stars));
        int count = 0;
        for (ProductRating rating : ratings) {
            if (rating.stars() == wanted) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return Counts indexed by star value; index 0 is unused
     */
    public static int[] starHistogram(List<ProductRating> ratings) {
        int[] histogram = new int[MAX_STARS + 1];
        for (ProductRating rating : ratings) {
            if (rating.stars() >= MIN_STARS && rating.stars() <= MAX_STARS) {
                histogram[rating.stars()]++;
            }
        }
        return histogram;
    }

    /**
     * Mean star value, 0.0 when there are no ratings.
     */
    public static double averageStars(List<ProductRating> ratings) {
        if (ratings.isEmpty()) {
            return 0.0;
        }
        int[] histogram = starHistogram(ratings);
        long total = 0;
        for (int stars = MIN_STARS; stars <= MAX_STARS; stars++) {
            total += (long) stars * histogram[stars];
        }
        return (double) total / ratings.size();
    }

    public static int goodRatings(List<SellerRating> ratings) {
        return (int) ratings.stream().filter(SellerRating::isGood).count();
    }

    public static int badRatings(List<SellerRating> ratings) {
        return (int) ratings.stream().filter(SellerRating::isBad).count();
    }

    public static int ratingsCount(List<SellerRating> ratings) {
        return ratings.size();
    }

    /**
     * Share of good ratings as a whole percentage, truncated. 0 when there are no ratings.
     */
    public static int reputation(List<SellerRating> ratings) {
        if (ratings.isEmpty()) {
            return 0;
        }
        return (int) (goodRatings(ratings) * 100L / ratings.size());
    }
}
