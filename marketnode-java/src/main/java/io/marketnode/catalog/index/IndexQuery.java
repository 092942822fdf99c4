package io.marketnode.catalog.index;

import io.marketnode.catalog.model.ContentType;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Predicate over {@link IndexEntry} rows, restricted to one content type.
 *
 * <ul>
 *   <li>{@link Mode#EXACT}: the search term equals the query term.</li>
 *   <li>{@link Mode#MATCH}: every query token is a whole word of the search
 *       term, except the last one which may also be a word prefix;
 *       case-insensitive.</li>
 *   <li>{@link Mode#ALL}: every entry of the content type.</li>
 * </ul>
 *
 * A limit of 0 means unlimited.
 */
public record IndexQuery(ContentType contentType, Mode mode, String term, int limit) {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    public enum Mode { EXACT, MATCH, ALL }

    public IndexQuery {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(mode, "mode");
        if (mode != Mode.ALL) {
            Objects.requireNonNull(term, "term");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }

    public static IndexQuery exact(String term, ContentType contentType) {
        return new IndexQuery(contentType, Mode.EXACT, term, 0);
    }

    public static IndexQuery matching(String term, ContentType contentType, int limit) {
        return new IndexQuery(contentType, Mode.MATCH, term, limit);
    }

    public static IndexQuery all(ContentType contentType) {
        return new IndexQuery(contentType, Mode.ALL, null, 0);
    }

    public IndexQuery withLimit(int newLimit) {
        return new IndexQuery(contentType, mode, term, newLimit);
    }

    public boolean hasLimit() {
        return limit > 0;
    }

    public boolean matches(IndexEntry entry) {
        if (entry.contentType() != contentType) {
            return false;
        }
        return switch (mode) {
            case ALL -> true;
            case EXACT -> term.equals(entry.searchTerm());
            case MATCH -> tokensMatch(entry.searchTerm());
        };
    }

    private boolean tokensMatch(String searchTerm) {
        String[] wanted = tokens(term);
        if (wanted.length == 0) {
            return false;
        }
        String[] available = tokens(searchTerm);
        for (int i = 0; i < wanted.length; i++) {
            String token = wanted[i];
            boolean prefix = i == wanted.length - 1;
            boolean found = Arrays.stream(available)
                .anyMatch(candidate -> prefix ? candidate.startsWith(token) : candidate.equals(token));
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static String[] tokens(String text) {
        return Arrays.stream(TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT)))
            .filter(token -> !token.isEmpty())
            .toArray(String[]::new);
    }
}
