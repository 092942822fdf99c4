package io.marketnode.storage.piece;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Metadata a listing or user document embeds so a receiver can verify and
 * reassemble a chunked attachment piece by piece.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("size") long size,
    @JsonProperty("piece_size") int pieceSize,
    @JsonProperty("pieces") List<String> pieces,
    @JsonProperty("id") Integer id,
    @JsonProperty("source") String source
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ObjectDescriptor {
        pieces = pieces != null ? List.copyOf(pieces) : List.of();
    }

    public static ObjectDescriptor of(String name, List<ObjectPiece> pieces, int pieceSize, Integer id, String source) {
        long size = pieces.stream().mapToLong(ObjectPiece::length).sum();
        List<String> hashes = pieces.stream().map(ObjectPiece::hash).toList();
        return new ObjectDescriptor(name, size, pieceSize, hashes, id, source);
    }

    public int pieceCount() {
        return pieces.size();
    }

    /**
     * Number of pieces the declared size and piece size imply.
     */
    public int expectedPieceCount() {
        if (pieceSize <= 0) return 0;
        return (int) ((size + pieceSize - 1) / pieceSize);
    }

    @JsonIgnore
    public boolean isConsistent() {
        return size > 0 && pieceSize > 0 && pieceCount() == expectedPieceCount();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode object descriptor", e);
        }
    }

    public static ObjectDescriptor fromJson(String json) {
        try {
            return MAPPER.readValue(json, ObjectDescriptor.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode object descriptor", e);
        }
    }
}
