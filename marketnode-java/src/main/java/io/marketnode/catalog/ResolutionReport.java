package io.marketnode.catalog;

import io.marketnode.catalog.model.TypedView;

import java.util.List;
import java.util.Optional;

/**
 * Outcomes of one resolution, in the order the index enumerated the keys.
 */
public record ResolutionReport<T extends TypedView>(List<KeyOutcome<T>> outcomes) {

    public ResolutionReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<T> views() {
        return outcomes.stream()
            .map(KeyOutcome::view)
            .flatMap(Optional::stream)
            .toList();
    }

    public List<String> purgedKeys() {
        return keysWith(KeyOutcome.Status.PURGED);
    }

    public List<String> keysWith(KeyOutcome.Status status) {
        return outcomes.stream()
            .filter(o -> o.status() == status)
            .map(KeyOutcome::key)
            .toList();
    }

    public long count(KeyOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public int size() {
        return outcomes.size();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
