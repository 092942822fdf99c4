package io.marketnode.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryRemoteStore implements RemoteStore {

    public static final String NOT_FOUND = "Key not found";

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final AtomicLong gets = new AtomicLong();
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong removes = new AtomicLong();
    private volatile Instant lastModified = Instant.now();

    @Override
    public StoreResponse get(String key) {
        gets.incrementAndGet();
        String value = values.get(key);
        if (value == null) {
            return StoreResponse.error(key, NOT_FOUND);
        }
        return StoreResponse.ok(key, value);
    }

    @Override
    public StoreResponse put(String key, String value) {
        puts.incrementAndGet();
        values.put(key, value);
        lastModified = Instant.now();
        return StoreResponse.ok(key);
    }

    @Override
    public StoreResponse remove(String key) {
        removes.incrementAndGet();
        boolean removed = values.remove(key) != null;
        if (!removed) {
            return StoreResponse.error(key, NOT_FOUND);
        }
        lastModified = Instant.now();
        return StoreResponse.ok(key);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public List<String> listKeys() {
        return new ArrayList<>(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
        lastModified = Instant.now();
    }

    public long getRequestCount() {
        return gets.get();
    }

    public long getPutCount() {
        return puts.get();
    }

    public long getRemoveCount() {
        return removes.get();
    }

    public Instant getLastModified() {
        return lastModified;
    }
}
