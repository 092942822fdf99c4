package io.marketnode.storage.piece;

import io.marketnode.storage.RemoteStore;
import io.marketnode.storage.RemoteUnavailableException;
import io.marketnode.storage.StoreResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Upload pipeline for binary attachments (product images, avatars).
 *
 * Packing reads the payload, enforces the size limit, cuts and hashes the
 * pieces and builds the {@link ObjectDescriptor} the owning document embeds.
 * Publishing hands each piece to the remote store under its own hash.
 */
public class AttachmentPacker {

    private static final Logger log = LoggerFactory.getLogger(AttachmentPacker.class);

    private final PieceHasher hasher;
    private final RemoteStore remoteStore;

    private final AtomicLong totalBytesPacked = new AtomicLong();
    private final AtomicLong totalObjectsPacked = new AtomicLong();
    private final AtomicLong totalPiecesPublished = new AtomicLong();

    private Consumer<ObjectPackedEvent> onObjectPacked;
    private Consumer<PiecePublishedEvent> onPiecePublished;

    public AttachmentPacker(PieceHasher hasher, RemoteStore remoteStore) {
        this.hasher = hasher;
        this.remoteStore = remoteStore;
    }

    /**
     * Pack a file from disk.
     * @param file Attachment path
     * @param id Position of the attachment within its owning document
     * @throws EmptyPayloadException if the file is empty or unreadable
     * @throws ObjectTooLargeException if the file exceeds the policy's maximum
     */
    public PackedObject pack(Path file, int id) {
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new EmptyPayloadException("Failed to read " + file, e);
        }
        return pack(data, file.toString(), id);
    }

    public PackedObject pack(byte[] data, String fileName, int id) {
        PieceSizePolicy policy = hasher.getPolicy();
        if (data.length == 0) {
            throw new EmptyPayloadException("Attachment " + fileName + " is empty");
        }
        if (!policy.isSupportedSize(data.length)) {
            throw new ObjectTooLargeException(data.length, policy.maxObjectSize());
        }

        List<ObjectPiece> pieces = hasher.hash(data);
        int pieceSize = policy.pieceSizeFor(data.length);
        ObjectDescriptor descriptor = ObjectDescriptor.of(contentName(fileName), pieces, pieceSize, id, fileName);

        if (descriptor.size() != data.length) {
            throw new IllegalStateException(
                "Descriptor size " + descriptor.size() + " does not match payload size " + data.length);
        }

        totalBytesPacked.addAndGet(data.length);
        totalObjectsPacked.incrementAndGet();
        log.debug("Packed {} into {} pieces of {} bytes", fileName, pieces.size(), pieceSize);

        if (onObjectPacked != null) {
            onObjectPacked.accept(new ObjectPackedEvent(descriptor.name(), descriptor.size(), pieces.size()));
        }
        return new PackedObject(descriptor, pieces);
    }

    /**
     * Store every piece in the remote store keyed by its hash.
     * Failed pieces are reported, not retried.
     */
    public PublishResult publish(PackedObject packed) {
        int stored = 0;
        List<String> failed = new ArrayList<>();
        List<ObjectPiece> pieces = packed.pieces();

        for (ObjectPiece piece : pieces) {
            String encoded = Base64.getEncoder().encodeToString(piece.bytes());
            StoreResponse response;
            try {
                response = remoteStore.put(piece.hash(), encoded);
            } catch (RemoteUnavailableException e) {
                response = StoreResponse.error(piece.hash(), e.getMessage());
            }

            if (response.isOk()) {
                stored++;
                totalPiecesPublished.incrementAndGet();
            } else {
                log.warn("Failed to publish piece {} of {}: {}", piece.index(), packed.descriptor().name(), response.error());
                failed.add(piece.hash());
            }

            if (onPiecePublished != null) {
                onPiecePublished.accept(new PiecePublishedEvent(
                    packed.descriptor().name(), piece.index(), piece.hash(), response.isOk(),
                    (double) (piece.index() + 1) / pieces.size()));
            }
        }
        return new PublishResult(stored, failed.size(), List.copyOf(failed));
    }

    /**
     * Content name of an attachment: SHA-256 of its base name without the
     * extension, followed by the original extension.
     */
    public static String contentName(String fileName) {
        String baseName = fileName.substring(Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\')) + 1);
        int dot = baseName.lastIndexOf('.');
        String stem = dot > 0 ? baseName.substring(0, dot) : baseName;
        String hash = PieceHasher.sha256Hex(stem.getBytes(StandardCharsets.UTF_8));
        return dot > 0 ? hash + baseName.substring(dot) : hash;
    }

    public PackerStats stats() {
        return new PackerStats(totalObjectsPacked.get(), totalBytesPacked.get(), totalPiecesPublished.get());
    }

    public void setOnObjectPacked(Consumer<ObjectPackedEvent> listener) { this.onObjectPacked = listener; }
    public void setOnPiecePublished(Consumer<PiecePublishedEvent> listener) { this.onPiecePublished = listener; }

    public record PackedObject(ObjectDescriptor descriptor, List<ObjectPiece> pieces) {}

    public record PublishResult(int storedCount, int failedCount, List<String> failedHashes) {
        public boolean isComplete() {
            return failedCount == 0;
        }
    }

    public record PackerStats(long objectsPacked, long bytesPacked, long piecesPublished) {}

    public record ObjectPackedEvent(String name, long size, int pieceCount) {}
    public record PiecePublishedEvent(String name, int index, String hash, boolean stored, double progress) {}
}
