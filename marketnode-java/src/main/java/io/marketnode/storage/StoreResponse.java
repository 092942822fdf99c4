package io.marketnode.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Outcome of a single {@link RemoteStore} request.
 * A response is either ok (optionally carrying a value) or carries an error message.
 */
public record StoreResponse(String key, String value, String error) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static StoreResponse ok(String key) {
        return new StoreResponse(key, null, null);
    }

    public static StoreResponse ok(String key, String value) {
        return new StoreResponse(key, value, null);
    }

    public static StoreResponse error(String key, String message) {
        return new StoreResponse(key, null, message != null ? message : "unknown error");
    }

    public boolean isOk() {
        return error == null;
    }

    public Optional<String> valueIfPresent() {
        return Optional.ofNullable(value);
    }

    /**
     * Decode the daemon's JSON envelope.
     * <pre>
     * {"response": {"value": "&lt;encoded document&gt;"}}   ok, value present
     * {"response": {}}                                  ok, no value
     * {"error": {...}}                                  error
     * </pre>
     * A value that is not a JSON string is dropped, the response stays ok.
     *
     * @param key The key the request was made for
     * @param envelope Raw response text
     * @return Decoded response
     * @throws IllegalArgumentException if the envelope is not JSON
     */
    public static StoreResponse fromEnvelope(String key, String envelope) {
        JsonNode root;
        try {
            root = MAPPER.readTree(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed store envelope for key " + key, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Store envelope is not an object for key " + key);
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.isTextual() ? error.asText()
                : error.path("message").asText(error.toString());
            return error(key, message);
        }

        JsonNode value = root.path("response").get("value");
        if (value != null && value.isTextual()) {
            return ok(key, value.asText());
        }
        return ok(key);
    }
}
