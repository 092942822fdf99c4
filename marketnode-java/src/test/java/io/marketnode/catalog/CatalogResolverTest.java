package io.marketnode.catalog;

import io.marketnode.catalog.KeyOutcome.Status;
import io.marketnode.catalog.index.InMemoryLocalIndex;
import io.marketnode.catalog.index.IndexEntry;
import io.marketnode.catalog.index.IndexQuery;
import io.marketnode.catalog.index.IndexUnavailableException;
import io.marketnode.catalog.model.ContentType;
import io.marketnode.catalog.model.Listing;
import io.marketnode.catalog.model.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogResolver")
class CatalogResolverTest {

    private InMemoryLocalIndex index;
    private ScriptedRemoteStore store;
    private CatalogResolver resolver;

    @BeforeEach
    void setUp() {
        index = new InMemoryLocalIndex();
        store = new ScriptedRemoteStore();
        resolver = new CatalogResolver(index, store, new DocumentProjector(),
            CatalogOptions.builder().concurrency(4).fetchTimeout(Duration.ofMillis(500)).build());
    }

    @AfterEach
    void tearDown() {
        resolver.shutdown().join();
    }

    private void indexListing(String key, String id, String name) {
        index.add(new IndexEntry("Books", ContentType.LISTING, key));
        store.putDocument(key, SampleDocuments.listing(id, name, 1.0));
    }

    private ResolutionReport<Listing> resolveBooks() {
        return resolver.resolve(IndexQuery.exact("Books", ContentType.LISTING), Listing.class);
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("should resolve every live key in enumeration order")
        void resolvesInOrder() {
            for (int i = 0; i < 20; i++) {
                indexListing("k" + i, "lst-" + i, "Book " + i);
            }

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(20, report.views().size());
            for (int i = 0; i < 20; i++) {
                assertEquals("k" + i, report.outcomes().get(i).key());
                assertEquals("lst-" + i, report.views().get(i).listingId());
            }
            assertEquals(0, store.getRemoveCount());
        }

        @Test
        @DisplayName("should fetch a key indexed under several terms once")
        void distinctKeys() {
            indexListing("k1", "lst-1", "Dune");
            index.add(new IndexEntry("Books", ContentType.LISTING, "k1"));

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(1, report.size());
            assertEquals(1, store.getRequestCount());
        }

        @Test
        @DisplayName("should return an empty report when nothing matches")
        void empty() {
            assertTrue(resolveBooks().isEmpty());
            assertEquals(0, store.getRequestCount());
        }

        @Test
        @DisplayName("should resolve a single view by exact term")
        void resolveOne() {
            index.add(new IndexEntry("4Abc", ContentType.USER, "user-key"));
            store.putDocument("user-key", SampleDocuments.user("4Abc"));

            Optional<User> user = resolver.resolveOne("4Abc", ContentType.USER, User.class);

            assertEquals("4Abc", user.orElseThrow().userId());
            assertTrue(resolver.resolveOne("nobody", ContentType.USER, User.class).isEmpty());
        }

        @Test
        @DisplayName("should refuse a view class of another content type")
        void wrongViewClass() {
            assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(IndexQuery.all(ContentType.LISTING), User.class));
        }

        @Test
        @DisplayName("should refuse to resolve after shutdown")
        void afterShutdown() {
            indexListing("k1", "lst-1", "Dune");
            resolver.shutdown().join();

            assertThrows(IllegalStateException.class, CatalogResolverTest.this::resolveBooks);
            assertThrows(IllegalStateException.class,
                () -> resolver.resolveOne("Books", ContentType.LISTING, Listing.class));
            assertEquals(0, store.getRequestCount());
        }

        @Test
        @DisplayName("should propagate an unavailable index")
        void indexUnavailable() {
            indexListing("k1", "lst-1", "Dune");
            index.setAvailable(false);

            assertThrows(IndexUnavailableException.class, CatalogResolverTest.this::resolveBooks);
            assertEquals(0, store.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Self-healing")
    class SelfHealingTests {

        @Test
        @DisplayName("should remove exactly the keys the store reports missing")
        void purgesMissingKeys() {
            indexListing("k1", "lst-1", "Dune");
            index.add(new IndexEntry("Books", ContentType.LISTING, "gone-1"));
            indexListing("k2", "lst-2", "Emma");
            index.add(new IndexEntry("Books", ContentType.LISTING, "gone-2"));
            List<CatalogResolver.KeyPurgedEvent> events = new CopyOnWriteArrayList<>();
            resolver.setOnKeyPurged(events::add);

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(2, report.views().size());
            assertEquals(List.of("gone-1", "gone-2"), report.purgedKeys());
            assertEquals(2, store.getRemoveCount());
            assertTrue(store.removedKeys.containsAll(List.of("gone-1", "gone-2")));
            assertEquals(2, events.size());
            assertEquals(2, resolver.getStats().purged());
        }

        @Test
        @DisplayName("should skip but keep a key whose store is unreachable")
        void unavailableStore() {
            indexListing("k1", "lst-1", "Dune");
            indexListing("k2", "lst-2", "Emma");
            store.unreachable.add("k1");
            List<CatalogResolver.KeySkippedEvent> skipped = new CopyOnWriteArrayList<>();
            resolver.setOnKeySkipped(skipped::add);

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(Status.UNAVAILABLE, report.outcomes().get(0).status());
            assertEquals(List.of("lst-2"), report.views().stream().map(Listing::listingId).toList());
            assertEquals(0, store.getRemoveCount());
            assertTrue(store.has("k1"));
            assertEquals(1, skipped.size());
        }

        @Test
        @DisplayName("should treat any other fetch failure as unavailable")
        void unexpectedFetchFailure() {
            indexListing("k1", "lst-1", "Dune");
            indexListing("k2", "lst-2", "Emma");
            store.broken.add("k2");

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(Status.RESOLVED, report.outcomes().get(0).status());
            assertEquals(Status.UNAVAILABLE, report.outcomes().get(1).status());
            assertTrue(report.outcomes().get(1).detail().contains("decoder crashed"));
            assertEquals(0, store.getRemoveCount());
            assertTrue(store.has("k2"));
        }

        @Test
        @DisplayName("should keep resolving when a listener throws")
        void throwingListeners() {
            indexListing("k1", "lst-1", "Dune");
            index.add(new IndexEntry("Books", ContentType.LISTING, "gone"));
            index.add(new IndexEntry("Books", ContentType.LISTING, "bad"));
            store.put("bad", "[]");
            resolver.setOnKeyPurged(event -> {
                throw new IllegalStateException("listener bug");
            });
            resolver.setOnKeySkipped(event -> {
                throw new IllegalStateException("listener bug");
            });

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(List.of("lst-1"), report.views().stream().map(Listing::listingId).toList());
            assertEquals(List.of("gone"), report.purgedKeys());
            assertEquals(1, report.count(Status.MALFORMED));
            assertFalse(store.has("gone"));
        }

        @Test
        @DisplayName("should leave a missing key in place when peeking")
        void peekDoesNotPurge() {
            index.add(new IndexEntry("4Abc", ContentType.USER, "lost-user"));

            assertTrue(resolver.peekOne("4Abc", ContentType.USER, User.class).isEmpty());
            assertEquals(0, store.getRemoveCount());

            assertTrue(resolver.resolveOne("4Abc", ContentType.USER, User.class).isEmpty());
            assertEquals(1, store.getRemoveCount());
        }

        @Test
        @DisplayName("should treat a slow fetch as unavailable")
        void timeout() {
            indexListing("k1", "lst-1", "Dune");
            indexListing("k2", "lst-2", "Emma");
            store.slow.add("k1");

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(Status.UNAVAILABLE, report.outcomes().get(0).status());
            assertTrue(report.outcomes().get(0).detail().contains("timed out"));
            assertEquals(Status.RESOLVED, report.outcomes().get(1).status());
            assertEquals(0, store.getRemoveCount());
        }

        @Test
        @DisplayName("should skip a response without a value and not remove it")
        void noValue() {
            indexListing("k1", "lst-1", "Dune");
            store.valueless.add("k1");

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(1, report.count(Status.NO_VALUE));
            assertEquals(0, store.getRemoveCount());
        }

        @Test
        @DisplayName("should not escalate a failed removal")
        void removalFailure() {
            indexListing("k1", "lst-1", "Dune");
            index.add(new IndexEntry("Books", ContentType.LISTING, "gone"));
            store.removeFails = true;

            ResolutionReport<Listing> report = resolveBooks();
            assertEquals(List.of("gone"), report.purgedKeys());
            assertEquals(1, report.views().size());

            store.removeThrows = true;
            assertEquals(List.of("gone"), resolveBooks().purgedKeys());
        }
    }

    @Nested
    @DisplayName("Bad documents")
    class BadDocumentTests {

        @Test
        @DisplayName("should skip documents tagged as another type without removing them")
        void metadataMismatch() {
            index.add(new IndexEntry("Books", ContentType.LISTING, "k1"));
            store.putDocument("k1", SampleDocuments.user("4Abc"));

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(1, report.count(Status.METADATA_MISMATCH));
            assertTrue(report.views().isEmpty());
            assertEquals(0, store.getRemoveCount());
            assertTrue(store.has("k1"));
        }

        @Test
        @DisplayName("should classify malformed and incomplete documents")
        void malformedAndIncomplete() {
            index.add(new IndexEntry("Books", ContentType.LISTING, "garbage"));
            store.put("garbage", "not json at all");
            index.add(new IndexEntry("Books", ContentType.LISTING, "scalar"));
            store.put("scalar", "42");
            index.add(new IndexEntry("Books", ContentType.LISTING, "partial"));
            store.putDocument("partial", SampleDocuments.listing("lst-1", "Dune", 1.0).remove(List.of("seller_id")));

            ResolutionReport<Listing> report = resolveBooks();

            assertEquals(List.of(Status.MALFORMED, Status.MALFORMED, Status.UNPARSEABLE),
                report.outcomes().stream().map(KeyOutcome::status).toList());
            assertEquals(0, store.getRemoveCount());
        }

        @Test
        @DisplayName("should resolve the well-formed documents among broken ones")
        void mixed() {
            indexListing("k1", "lst-1", "Dune");
            index.add(new IndexEntry("Books", ContentType.LISTING, "bad"));
            store.put("bad", "[]");
            indexListing("k2", "lst-2", "Emma");

            List<Listing> views = resolver.resolveViews(IndexQuery.exact("Books", ContentType.LISTING), Listing.class);

            assertEquals(List.of("lst-1", "lst-2"), views.stream().map(Listing::listingId).toList());
            assertEquals(1, resolver.getStats().skipped());
        }
    }
}
