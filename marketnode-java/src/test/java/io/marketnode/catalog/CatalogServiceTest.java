package io.marketnode.catalog;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketnode.catalog.index.InMemoryLocalIndex;
import io.marketnode.catalog.index.IndexEntry;
import io.marketnode.catalog.model.ContentType;
import io.marketnode.catalog.model.Listing;
import io.marketnode.storage.InMemoryRemoteStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogService")
class CatalogServiceTest {

    private InMemoryLocalIndex index;
    private InMemoryRemoteStore store;
    private CatalogResolver resolver;
    private CatalogService service;

    @BeforeEach
    void setUp() {
        index = new InMemoryLocalIndex();
        store = new InMemoryRemoteStore();
        resolver = new CatalogResolver(index, store);
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
        service = new CatalogService(resolver, new CatalogAssembler(resolver.getOptions()), clock);

        publishListing("lk-1", SampleDocuments.listing("lst-1", "alice", "Red Shirt", "Clothing", 2.0, "2024-01-03T00:00:00Z"));
        publishListing("lk-2", SampleDocuments.listing("lst-2", "alice", "Blue Shirt", "Clothing", 1.0, "2024-01-01T00:00:00Z"));
        publishListing("lk-3", SampleDocuments.listing("lst-3", "bob", "Mystery Box", "Illicit", 9.0, "2024-01-02T00:00:00Z"));

        publishUser("uk-alice", SampleDocuments.user("alice"));
        ObjectNode bob = SampleDocuments.user("bob");
        bob.put("display_name", "Bobby");
        publishUser("uk-bob", bob);
        publishProductRating("pr-1", "lst-1", SampleDocuments.productRating("bob", 5));
        publishProductRating("pr-2", "lst-1", SampleDocuments.productRating("carol", 3));
        publishProductRating("pr-3", "lst-1", SampleDocuments.productRating("dave", 5));
        publishSellerRating("sr-1", "alice", SampleDocuments.sellerRating("bob", 1));
        publishSellerRating("sr-2", "alice", SampleDocuments.sellerRating("carol", 0));
        publishSellerRating("sr-3", "alice", SampleDocuments.sellerRating("dave", 1));
    }

    @AfterEach
    void tearDown() {
        resolver.shutdown().join();
    }

    private void publishListing(String key, ObjectNode doc) {
        store.put(key, doc.toString());
        ObjectNode product = (ObjectNode) doc.get("product");
        for (String term : List.of(doc.get("id").asText(), doc.get("seller_id").asText(),
                product.get("name").asText(), product.get("category").asText())) {
            index.add(new IndexEntry(term, ContentType.LISTING, key));
        }
    }

    private void publishUser(String key, ObjectNode doc) {
        store.put(key, doc.toString());
        index.add(new IndexEntry(doc.get("monero_address").asText(), ContentType.USER, key));
    }

    private void publishProductRating(String key, String listingId, ObjectNode doc) {
        store.put(key, doc.toString());
        index.add(new IndexEntry(listingId, ContentType.PRODUCT_RATING, key));
    }

    private void publishSellerRating(String key, String sellerId, ObjectNode doc) {
        store.put(key, doc.toString());
        index.add(new IndexEntry(sellerId, ContentType.SELLER_RATING, key));
    }

    private static List<String> ids(List<Listing> listings) {
        return listings.stream().map(Listing::listingId).toList();
    }

    @Nested
    @DisplayName("Listings")
    class ListingTests {

        @Test
        @DisplayName("should list and sort all listings")
        void allListings() {
            assertEquals(List.of("lst-1", "lst-2", "lst-3"), ids(service.getListings(SortOrder.NONE, false)));
            assertEquals(List.of("lst-2", "lst-1"), ids(service.getListings(SortOrder.PRICE_LOWEST, true)));
        }

        @Test
        @DisplayName("should search by word prefixes")
        void search() {
            assertEquals(List.of("lst-1", "lst-2"), ids(service.getListingsBySearchTerm("shir", true)));
            assertEquals(List.of("lst-1"), ids(service.getListingsBySearchTerm("red shirt", true)));
            assertTrue(service.getListingsBySearchTerm("mystery", true).isEmpty());
            assertEquals(List.of("lst-3"), ids(service.getListingsBySearchTerm("mystery", false)));
        }

        @Test
        @DisplayName("should cap search results")
        void searchLimit() {
            CatalogResolver capped = new CatalogResolver(index, store, new DocumentProjector(),
                CatalogOptions.builder().maxSearchResults(1).build());
            try {
                assertEquals(1, new CatalogService(capped).getListingsBySearchTerm("shirt", false).size());
            } finally {
                capped.shutdown().join();
            }
        }

        @Test
        @DisplayName("should list by category and most recent")
        void categoryAndRecent() {
            assertEquals(List.of("lst-1", "lst-2"), ids(service.getListingsByCategory("Clothing", true)));
            assertEquals(List.of("lst-1", "lst-3"), ids(service.getListingsByMostRecent(2, false)));
            assertEquals(List.of("lst-1", "lst-2"), ids(service.getListingsByMostRecent(2, true)));
        }

        @Test
        @DisplayName("should list a seller's inventory")
        void inventory() {
            assertEquals(List.of("lst-1", "lst-2"), ids(service.getInventory("alice", true)));
            assertTrue(service.getInventory("bob", true).isEmpty());
            assertEquals(List.of("lst-3"), ids(service.getInventory("bob", false)));
        }

        @Test
        @DisplayName("should report stock and category counts")
        void stockAndCounts() {
            assertEquals(10, service.getStockAvailable("lst-1"));
            assertEquals(0, service.getStockAvailable("lst-404"));
            assertEquals(2, service.getCategoryProductCount("Clothing"));
            assertEquals(0, service.getCategoryProductCount("Garden"));
        }

        @Test
        @DisplayName("should drop and purge listings that vanished from the store")
        void vanishedListing() {
            store.remove("lk-2");
            long removesBefore = store.getRemoveCount();

            assertEquals(List.of("lst-1"), ids(service.getListingsByCategory("Clothing", true)));
            assertEquals(removesBefore + 1, store.getRemoveCount());
        }
    }

    @Nested
    @DisplayName("Users and ratings")
    class UserAndRatingTests {

        @Test
        @DisplayName("should find a user by id")
        void user() {
            assertEquals("alice", service.getUser("alice").orElseThrow().userId());
            assertTrue(service.getUser("mallory").isEmpty());
        }

        @Test
        @DisplayName("should fall back to the user id for display names")
        void displayName() {
            assertEquals("Bobby", service.getDisplayNameByUserId("bob"));
            assertEquals("alice", service.getDisplayNameByUserId("alice"));
            assertEquals("mallory", service.getDisplayNameByUserId("mallory"));
        }

        @Test
        @DisplayName("should not remove a missing profile when looking up a display name")
        void displayNameKeepsMissingProfile() {
            index.add(new IndexEntry("erin", ContentType.USER, "uk-erin"));
            long removesBefore = store.getRemoveCount();

            assertEquals("erin", service.getDisplayNameByUserId("erin"));
            assertEquals(removesBefore, store.getRemoveCount());
        }

        @Test
        @DisplayName("should compute account age in days")
        void accountAge() {
            assertEquals(60, service.getAccountAge("alice"));
            assertEquals(-1, service.getAccountAge("mallory"));

            ObjectNode undated = SampleDocuments.user("frank");
            undated.put("created_at", "sometime last year");
            publishUser("uk-frank", undated);
            assertEquals(-1, service.getAccountAge("frank"));
        }

        @Test
        @DisplayName("should aggregate product ratings")
        void productRatings() {
            assertEquals(3, service.getProductRatings("lst-1").size());
            assertEquals(2, service.getProductStarCount("lst-1", 5));
            assertEquals(1, service.getProductStarCount("lst-1", 3));
            assertEquals(13.0 / 3, service.getProductAverageStars("lst-1"), 1e-9);
            assertEquals(0.0, service.getProductAverageStars("lst-2"));
        }

        @Test
        @DisplayName("should compute seller reputation")
        void sellerReputation() {
            assertEquals(3, service.getSellerRatings("alice").size());
            assertEquals(66, service.getSellerReputation("alice"));
            assertEquals(0, service.getSellerReputation("bob"));
        }

        @Test
        @DisplayName("should count good, bad and total seller ratings")
        void sellerRatingCounts() {
            assertEquals(2, service.getSellerGoodRatings("alice"));
            assertEquals(1, service.getSellerBadRatings("alice"));
            assertEquals(3, service.getSellerRatingsCount("alice"));
            assertEquals(0, service.getSellerRatingsCount("bob"));
        }
    }
}
