package io.marketnode.catalog;

import io.marketnode.catalog.model.TypedView;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one index key during resolution.
 *
 * @param key    Remote key taken from the index
 * @param status Outcome
 * @param view   Projected view, present only for {@link Status#RESOLVED}
 * @param detail Human-readable reason for non-resolved outcomes, empty otherwise
 */
public record KeyOutcome<T extends TypedView>(String key, Status status, Optional<T> view, String detail) {

    public enum Status {
        RESOLVED,
        /** Store reported the key missing; it was removed from the store. */
        PURGED,
        /** Store unreachable, failed or timed out. */
        UNAVAILABLE,
        NO_VALUE,
        MALFORMED,
        METADATA_MISMATCH,
        UNPARSEABLE
    }

    public KeyOutcome {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(view, "view");
        if (view.isPresent() != (status == Status.RESOLVED)) {
            throw new IllegalArgumentException("view must be present exactly when resolved");
        }
        detail = detail == null ? "" : detail;
    }

    public static <T extends TypedView> KeyOutcome<T> resolved(String key, T view) {
        return new KeyOutcome<>(key, Status.RESOLVED, Optional.of(view), "");
    }

    public static <T extends TypedView> KeyOutcome<T> skipped(String key, Status status, String detail) {
        return new KeyOutcome<>(key, status, Optional.empty(), detail);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
