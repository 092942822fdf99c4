package io.marketnode.catalog.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only index held in memory. Rows are kept in insertion order.
 */
public class InMemoryLocalIndex implements LocalIndex {

    private final List<IndexEntry> entries = new CopyOnWriteArrayList<>();
    private volatile boolean available = true;

    public void add(IndexEntry entry) {
        entries.add(entry);
    }

    public void addAll(List<IndexEntry> newEntries) {
        entries.addAll(newEntries);
    }

    /**
     * Drop every row pointing at the key.
     * @return Number of rows removed
     */
    public int removeKey(String key) {
        List<IndexEntry> doomed = entries.stream().filter(e -> e.key().equals(key)).toList();
        entries.removeAll(doomed);
        return doomed.size();
    }

    @Override
    public List<String> keys(IndexQuery query) {
        if (!available) {
            throw new IndexUnavailableException("Local index is not available");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (IndexEntry entry : entries) {
            if (query.matches(entry)) {
                distinct.add(entry.key());
                if (query.hasLimit() && distinct.size() >= query.limit()) {
                    break;
                }
            }
        }
        return new ArrayList<>(distinct);
    }

    public List<IndexEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public boolean isAvailable() {
        return available;
    }
}
