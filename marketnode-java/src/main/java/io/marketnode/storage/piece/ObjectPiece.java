package io.marketnode.storage.piece;

/**
 * One content-addressed piece of a payload.
 *
 * @param index Position in the piece sequence, starting at 0
 * @param offset Byte offset of the piece within the payload
 * @param length Number of bytes in the piece
 * @param hash SHA-256 of the piece bytes, lower-case hex
 * @param bytes The piece bytes
 */
public record ObjectPiece(int index, long offset, int length, String hash, byte[] bytes) {

    public long end() {
        return offset + length;
    }
}
