package io.marketnode.storage.piece;

public class ObjectTooLargeException extends RuntimeException {

    private final long size;
    private final long maxSize;

    public ObjectTooLargeException(long size, long maxSize) {
        super("Object of " + size + " bytes exceeds the maximum of " + maxSize + " bytes");
        this.size = size;
        this.maxSize = maxSize;
    }

    public long getSize() {
        return size;
    }

    public long getMaxSize() {
        return maxSize;
    }
}
