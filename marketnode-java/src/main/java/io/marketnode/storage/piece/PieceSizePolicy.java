package io.marketnode.storage.piece;

/**
 * Tiered piece-size selection for attachments.
 *
 * Thresholds start at the maximum object size and halve down to twice the
 * floor. An object at or above a threshold is cut into pieces of half that
 * threshold; anything smaller than the last threshold uses the floor size.
 * With the default 2 MiB maximum:
 * <pre>
 *   size >= 2 MiB   -> 1 MiB
 *   size >= 1 MiB   -> 512 KiB
 *   size >= 512 KiB -> 256 KiB
 *   ...
 *   size >= 32 KiB  -> 16 KiB
 *   otherwise       -> 16 KiB
 * </pre>
 */
public final class PieceSizePolicy {

    public static final int MIN_PIECE_SIZE = 16 * 1024;
    public static final long DEFAULT_MAX_OBJECT_SIZE = 2L * 1024 * 1024;
    /** Largest maximum whose top piece size still fits in an int. */
    public static final long MAX_SUPPORTED_OBJECT_SIZE = 1L << 31;

    private final long maxObjectSize;

    public PieceSizePolicy(long maxObjectSize) {
        if (maxObjectSize < 2L * MIN_PIECE_SIZE) {
            throw new IllegalArgumentException(
                "Maximum object size must be at least " + (2 * MIN_PIECE_SIZE) + " bytes, got " + maxObjectSize);
        }
        if (Long.bitCount(maxObjectSize) != 1) {
            throw new IllegalArgumentException("Maximum object size must be a power of two, got " + maxObjectSize);
        }
        if (maxObjectSize > MAX_SUPPORTED_OBJECT_SIZE) {
            throw new IllegalArgumentException(
                "Maximum object size must not exceed " + MAX_SUPPORTED_OBJECT_SIZE + " bytes, got " + maxObjectSize);
        }
        this.maxObjectSize = maxObjectSize;
    }

    public static PieceSizePolicy defaults() {
        return new PieceSizePolicy(DEFAULT_MAX_OBJECT_SIZE);
    }

    /**
     * Piece size for an object of the given size.
     * @param size Object size in bytes, not negative
     * @return Piece size in bytes
     */
    public int pieceSizeFor(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + size);
        }
        for (long threshold = maxObjectSize; threshold >= 2L * MIN_PIECE_SIZE; threshold /= 2) {
            if (size >= threshold) {
                return Math.toIntExact(threshold / 2);
            }
        }
        return MIN_PIECE_SIZE;
    }

    /**
     * Whether an attachment of this size may be published at all.
     */
    public boolean isSupportedSize(long size) {
        return size > 0 && size <= maxObjectSize;
    }

    public long maxObjectSize() {
        return maxObjectSize;
    }

    @Override
    public String toString() {
        return "PieceSizePolicy[maxObjectSize=" + maxObjectSize + "]";
    }
}
