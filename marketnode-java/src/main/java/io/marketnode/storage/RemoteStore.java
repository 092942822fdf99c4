package io.marketnode.storage;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Client handle for the distributed key-value store (DHT).
 * Documents are identified by opaque keys and stored as encoded strings.
 *
 * Implementations must allow concurrent use by multiple in-flight requests.
 * A transport failure or timeout is reported by throwing
 * {@link RemoteUnavailableException}; a store-side failure (including a
 * missing key) is reported through {@link StoreResponse#error()}.
 */
public interface RemoteStore {

    // ==================== Synchronous Operations ====================

    /**
     * Fetch a document.
     * @param key Remote key
     * @return Response carrying the value, or an error when the key is missing
     * @throws RemoteUnavailableException if the store cannot be reached
     */
    StoreResponse get(String key);

    /**
     * Store a document.
     * @param key Remote key
     * @param value Encoded document
     * @return Response acknowledging the write, or an error
     * @throws RemoteUnavailableException if the store cannot be reached
     */
    StoreResponse put(String key, String value);

    /**
     * Remove a document.
     * @param key Remote key
     * @return Response acknowledging the removal, or an error
     * @throws RemoteUnavailableException if the store cannot be reached
     */
    StoreResponse remove(String key);

    // ==================== Asynchronous Operations ====================

    default CompletableFuture<StoreResponse> getAsync(String key) {
        return getAsync(key, ForkJoinPool.commonPool());
    }

    default CompletableFuture<StoreResponse> getAsync(String key, Executor executor) {
        return CompletableFuture.supplyAsync(() -> get(key), executor);
    }

    default CompletableFuture<StoreResponse> putAsync(String key, String value) {
        return CompletableFuture.supplyAsync(() -> put(key, value));
    }

    default CompletableFuture<StoreResponse> removeAsync(String key) {
        return CompletableFuture.supplyAsync(() -> remove(key));
    }

    // ==================== Batch Operations ====================

    /**
     * Store several documents, one request each.
     * @param entries Key-value pairs to store
     * @return Counts of acknowledged and failed writes
     */
    default BatchResult putBatch(List<StoreEntry> entries) {
        int success = 0;
        List<String> failed = new java.util.ArrayList<>();
        for (StoreEntry entry : entries) {
            StoreResponse response;
            try {
                response = put(entry.key(), entry.value());
            } catch (RemoteUnavailableException e) {
                response = StoreResponse.error(entry.key(), e.getMessage());
            }
            if (response.isOk()) {
                success++;
            } else {
                failed.add(entry.key());
            }
        }
        return new BatchResult(success, failed.size(), List.copyOf(failed));
    }

    // ==================== Records ====================

    record StoreEntry(String key, String value) {}

    record BatchResult(int successCount, int failedCount, List<String> failedKeys) {
        public boolean isComplete() {
            return failedCount == 0;
        }
    }
}
