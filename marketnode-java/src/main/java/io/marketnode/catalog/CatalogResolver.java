package io.marketnode.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketnode.catalog.KeyOutcome.Status;
import io.marketnode.catalog.index.IndexQuery;
import io.marketnode.catalog.index.LocalIndex;
import io.marketnode.catalog.model.ContentType;
import io.marketnode.catalog.model.TypedView;
import io.marketnode.storage.RemoteStore;
import io.marketnode.storage.RemoteUnavailableException;
import io.marketnode.storage.StoreResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Turns index lookups into validated views fetched from the remote store.
 *
 * Every key produced by the index is fetched independently on the resolver's
 * worker pool. A key the store reports as missing is removed from the store
 * (best effort); any other failure only skips the key. Outcomes are returned
 * in the order the index enumerated the keys.
 */
public class CatalogResolver {

    private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);

    private final LocalIndex localIndex;
    private final RemoteStore remoteStore;
    private final DocumentProjector projector;
    private final CatalogOptions options;
    private final ExecutorService executor;

    private final AtomicLong totalResolved = new AtomicLong();
    private final AtomicLong totalPurged = new AtomicLong();
    private final AtomicLong totalSkipped = new AtomicLong();

    private Consumer<KeyPurgedEvent> onKeyPurged;
    private Consumer<KeySkippedEvent> onKeySkipped;

    public CatalogResolver(LocalIndex localIndex, RemoteStore remoteStore) {
        this(localIndex, remoteStore, new DocumentProjector(), CatalogOptions.defaults());
    }

    public CatalogResolver(LocalIndex localIndex, RemoteStore remoteStore,
                           DocumentProjector projector, CatalogOptions options) {
        this.localIndex = localIndex;
        this.remoteStore = remoteStore;
        this.projector = projector;
        this.options = options;
        this.executor = Executors.newFixedThreadPool(options.concurrency);
    }

    /**
     * Resolve every key matching the query.
     * @param query Index query; its content type selects the projection
     * @param viewType View class of the query's content type
     * @return One outcome per distinct key, in enumeration order
     * @throws io.marketnode.catalog.index.IndexUnavailableException if the index cannot be queried
     * @throws IllegalArgumentException if the view class does not belong to the content type
     * @throws IllegalStateException if the resolver has been shut down
     */
    public <T extends TypedView> ResolutionReport<T> resolve(IndexQuery query, Class<T> viewType) {
        ContentType contentType = query.contentType();
        if (!contentType.viewType().equals(viewType)) {
            throw new IllegalArgumentException(
                "Content type " + contentType + " projects to " + contentType.viewType().getSimpleName()
                    + ", not " + viewType.getSimpleName());
        }

        checkRunning();
        List<String> keys = localIndex.keys(query);
        log.debug("Resolving {} {} key(s) for {} query", keys.size(), contentType, query.mode());

        List<CompletableFuture<KeyOutcome<T>>> futures = new ArrayList<>(keys.size());
        for (String key : keys) {
            futures.add(resolveKey(key, contentType, viewType, true));
        }

        List<KeyOutcome<T>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<KeyOutcome<T>> future : futures) {
            outcomes.add(future.join());
        }

        ResolutionReport<T> report = new ResolutionReport<>(outcomes);
        if (log.isDebugEnabled()) {
            log.debug("Resolved {}/{} {} key(s), purged {}", report.count(Status.RESOLVED),
                report.size(), contentType, report.count(Status.PURGED));
        }
        return report;
    }

    public <T extends TypedView> List<T> resolveViews(IndexQuery query, Class<T> viewType) {
        return resolve(query, viewType).views();
    }

    /**
     * Resolve the first key indexed under exactly this term.
     */
    public <T extends TypedView> Optional<T> resolveOne(String searchTerm, ContentType contentType, Class<T> viewType) {
        return resolveFirst(searchTerm, contentType, viewType, true);
    }

    /**
     * Like {@link #resolveOne} but never removes the key, even when the store reports it missing.
     */
    public <T extends TypedView> Optional<T> peekOne(String searchTerm, ContentType contentType, Class<T> viewType) {
        return resolveFirst(searchTerm, contentType, viewType, false);
    }

    private <T extends TypedView> Optional<T> resolveFirst(
            String searchTerm, ContentType contentType, Class<T> viewType, boolean purgeMissing) {
        if (!contentType.viewType().equals(viewType)) {
            throw new IllegalArgumentException(
                "Content type " + contentType + " does not project to " + viewType.getSimpleName());
        }
        checkRunning();
        Optional<String> key = localIndex.lookupExact(searchTerm, contentType);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return resolveKey(key.get(), contentType, viewType, purgeMissing).join().view();
    }

    private void checkRunning() {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Resolver has been shut down");
        }
    }

    private <T extends TypedView> CompletableFuture<KeyOutcome<T>> resolveKey(
            String key, ContentType contentType, Class<T> viewType, boolean purgeMissing) {
        return CompletableFuture.supplyAsync(() -> remoteStore.get(key), executor)
            .orTimeout(options.fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((response, error) -> {
                KeyOutcome<T> outcome = error != null
                    ? unavailable(key, error)
                    : interpret(key, response, contentType, viewType, purgeMissing);
                tally(outcome, contentType);
                return outcome;
            });
    }

    private <T extends TypedView> KeyOutcome<T> unavailable(String key, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error;
        String detail;
        if (cause instanceof TimeoutException) {
            detail = "fetch timed out after " + options.fetchTimeout.toMillis() + " ms";
        } else if (cause instanceof RemoteUnavailableException) {
            detail = "store unavailable: " + cause.getMessage();
        } else {
            detail = "fetch failed: " + cause;
        }
        log.debug("Skipping key {}: {}", key, detail);
        return KeyOutcome.skipped(key, Status.UNAVAILABLE, detail);
    }

    private <T extends TypedView> KeyOutcome<T> interpret(
            String key, StoreResponse response, ContentType contentType, Class<T> viewType, boolean purgeMissing) {
        if (response == null) {
            return KeyOutcome.skipped(key, Status.NO_VALUE, "empty response");
        }
        if (!response.isOk()) {
            if (!purgeMissing) {
                log.debug("Key {} is missing from the store, left in place ({})", key, response.error());
                return KeyOutcome.skipped(key, Status.NO_VALUE, response.error());
            }
            purge(key, response.error());
            return KeyOutcome.skipped(key, Status.PURGED, response.error());
        }
        Optional<String> value = response.valueIfPresent();
        if (value.isEmpty()) {
            return KeyOutcome.skipped(key, Status.NO_VALUE, "response carries no value");
        }
        Optional<JsonNode> document = projector.parseDocument(value.get());
        if (document.isEmpty()) {
            return KeyOutcome.skipped(key, Status.MALFORMED, "value is not a JSON object");
        }

        Projection<? extends TypedView> projection = projector.project(key, document.get(), contentType);
        if (projection instanceof Projection.Rejected<?> rejected) {
            return switch (rejected.reason()) {
                case MALFORMED_DOCUMENT -> KeyOutcome.skipped(key, Status.MALFORMED, rejected.detail());
                case METADATA_MISMATCH -> {
                    log.warn("Metadata mismatch for key {}: {}", key, rejected.detail());
                    yield KeyOutcome.skipped(key, Status.METADATA_MISMATCH, rejected.detail());
                }
                case MISSING_FIELD -> KeyOutcome.skipped(key, Status.UNPARSEABLE, rejected.detail());
            };
        }
        TypedView view = projection.view().orElseThrow();
        return KeyOutcome.resolved(key, viewType.cast(view));
    }

    private void purge(String key, String reason) {
        log.info("Removing stale key {} ({})", key, reason);
        try {
            StoreResponse removal = remoteStore.remove(key);
            if (!removal.isOk()) {
                log.warn("Failed to remove stale key {}: {}", key, removal.error());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to remove stale key {}", key, e);
        }
        fire(onKeyPurged, new KeyPurgedEvent(key, reason));
    }

    private void tally(KeyOutcome<?> outcome, ContentType contentType) {
        switch (outcome.status()) {
            case RESOLVED -> totalResolved.incrementAndGet();
            case PURGED -> totalPurged.incrementAndGet();
            default -> {
                totalSkipped.incrementAndGet();
                fire(onKeySkipped, new KeySkippedEvent(outcome.key(), contentType, outcome.status(), outcome.detail()));
            }
        }
    }

    private static <E> void fire(Consumer<E> listener, E event) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {}", event, e);
        }
    }

    public ResolverStats getStats() {
        return new ResolverStats(totalResolved.get(), totalPurged.get(), totalSkipped.get());
    }

    public CatalogOptions getOptions() {
        return options;
    }

    public LocalIndex getLocalIndex() {
        return localIndex;
    }

    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(() -> {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }

    public void setOnKeyPurged(Consumer<KeyPurgedEvent> listener) { this.onKeyPurged = listener; }
    public void setOnKeySkipped(Consumer<KeySkippedEvent> listener) { this.onKeySkipped = listener; }

    public record ResolverStats(long resolved, long purged, long skipped) {}

    public record KeyPurgedEvent(String key, String reason) {}

    public record KeySkippedEvent(String key, ContentType contentType, Status status, String detail) {}
}
