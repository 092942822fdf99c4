package io.marketnode.catalog;

import io.marketnode.catalog.model.TypedView;

import java.util.Optional;

/**
 * Result of projecting a remote document: either a valid view or a rejection.
 */
public interface Projection<T extends TypedView> {

    enum Rejection {
        /** The value is not a JSON object. */
        MALFORMED_DOCUMENT,
        /** The {@code metadata} tag is absent or names another content type. */
        METADATA_MISMATCH,
        /** A required field is absent or has the wrong JSON type. */
        MISSING_FIELD
    }

    boolean isValid();

    Optional<T> view();

    static <T extends TypedView> Projection<T> valid(T view) {
        return new Valid<>(view);
    }

    static <T extends TypedView> Projection<T> rejected(Rejection reason, String detail) {
        return new Rejected<>(reason, detail);
    }

    record Valid<T extends TypedView>(T value) implements Projection<T> {
        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Optional<T> view() {
            return Optional.of(value);
        }
    }

    record Rejected<T extends TypedView>(Rejection reason, String detail) implements Projection<T> {
        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Optional<T> view() {
            return Optional.empty();
        }
    }
}
