package io.marketnode.storage.piece;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Splits a payload into content-addressed pieces.
 *
 * The piece size comes from a {@link PieceSizePolicy} applied to the total
 * payload size. Every piece is hashed with SHA-256 over exactly its own bytes.
 * When an executor is supplied the digests are computed concurrently; the
 * returned list is always ordered by piece index.
 *
 * This class performs no writes of any kind.
 */
public class PieceHasher {

    private static final String HASH_ALGORITHM = "SHA-256";

    private final PieceSizePolicy policy;
    private final ExecutorService executor;

    public PieceHasher() {
        this(PieceSizePolicy.defaults());
    }

    public PieceHasher(PieceSizePolicy policy) {
        this(policy, null);
    }

    public PieceHasher(PieceSizePolicy policy, ExecutorService executor) {
        this.policy = policy;
        this.executor = executor;
    }

    public List<ObjectPiece> hash(byte[] payload) {
        try {
            return hash(new ByteArrayInputStream(payload), payload.length);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory read failed", e);
        }
    }

    /**
     * Read {@code size} bytes from the source and cut them into pieces.
     * @param source Byte source, read but not closed
     * @param size Total number of bytes the source is expected to yield
     * @return Pieces in stream order
     * @throws EmptyPayloadException if the source yields no bytes
     * @throws IllegalStateException if the pieces do not cover exactly {@code size} bytes
     * @throws EOFException if the source yields fewer than {@code size} bytes
     * @throws IOException if reading fails
     */
    public List<ObjectPiece> hash(InputStream source, long size) throws IOException {
        if (size < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + size);
        }
        int pieceSize = policy.pieceSizeFor(size);

        List<byte[]> chunks = new ArrayList<>();
        long remaining = size;
        while (remaining > 0) {
            int want = (int) Math.min(pieceSize, remaining);
            byte[] chunk = source.readNBytes(want);
            if (chunk.length == 0) {
                break;
            }
            chunks.add(chunk);
            remaining -= chunk.length;
            if (chunk.length < want) {
                break;
            }
        }

        if (chunks.isEmpty()) {
            throw new EmptyPayloadException("Payload is empty or could not be read");
        }
        if (remaining > 0) {
            throw new EOFException("Source ended after " + (size - remaining) + " of " + size + " bytes");
        }

        List<ObjectPiece> pieces = digestAll(chunks);
        checkCoverage(pieces, size);
        return pieces;
    }

    /**
     * Hash a file on disk.
     * @throws EmptyPayloadException if the file is empty, missing, unreadable or shrinks while being read
     */
    public List<ObjectPiece> hashFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return hash(in, Files.size(file));
        } catch (IOException e) {
            throw new EmptyPayloadException("Failed to read " + file, e);
        }
    }

    /**
     * Recompute a piece's digest and compare it with the recorded hash.
     */
    public boolean verify(ObjectPiece piece) {
        return piece.bytes().length == piece.length() && sha256Hex(piece.bytes()).equals(piece.hash());
    }

    public PieceSizePolicy getPolicy() {
        return policy;
    }

    private List<ObjectPiece> digestAll(List<byte[]> chunks) {
        List<ObjectPiece> pieces = new ArrayList<>(chunks.size());
        if (executor == null || chunks.size() == 1) {
            long offset = 0;
            for (int i = 0; i < chunks.size(); i++) {
                byte[] chunk = chunks.get(i);
                pieces.add(new ObjectPiece(i, offset, chunk.length, sha256Hex(chunk), chunk));
                offset += chunk.length;
            }
            return pieces;
        }

        List<CompletableFuture<String>> digests = new ArrayList<>(chunks.size());
        for (byte[] chunk : chunks) {
            digests.add(CompletableFuture.supplyAsync(() -> sha256Hex(chunk), executor));
        }
        long offset = 0;
        for (int i = 0; i < chunks.size(); i++) {
            byte[] chunk = chunks.get(i);
            String hash;
            try {
                hash = digests.get(i).join();
            } catch (CompletionException e) {
                throw new IllegalStateException("Failed to hash piece " + i, e.getCause());
            }
            pieces.add(new ObjectPiece(i, offset, chunk.length, hash, chunk));
            offset += chunk.length;
        }
        return pieces;
    }

    private static void checkCoverage(List<ObjectPiece> pieces, long size) {
        long covered = 0;
        for (ObjectPiece piece : pieces) {
            if (piece.offset() != covered) {
                throw new IllegalStateException(
                    "Piece " + piece.index() + " starts at " + piece.offset() + ", expected " + covered);
            }
            covered = piece.end();
        }
        if (covered != size) {
            throw new IllegalStateException("Pieces cover " + covered + " bytes, payload is " + size);
        }
    }

    static String sha256Hex(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance(HASH_ALGORITHM);
            return HexFormat.of().formatHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
