package io.marketnode.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketnode.catalog.Projection.Rejection;
import io.marketnode.catalog.model.ContentType;
import io.marketnode.catalog.model.ImageRef;
import io.marketnode.catalog.model.Listing;
import io.marketnode.catalog.model.Product;
import io.marketnode.catalog.model.ProductRating;
import io.marketnode.catalog.model.SellerRating;
import io.marketnode.catalog.model.TypedView;
import io.marketnode.catalog.model.User;
import io.marketnode.storage.piece.ObjectDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps untyped remote documents onto typed views.
 *
 * Projection is a pure function of the document. It never throws for bad
 * input: a document that is not an object, carries the wrong {@code metadata}
 * tag or lacks a required field comes back as {@link Projection.Rejected}.
 * Optional fields are read only when present with the expected JSON type.
 */
public class DocumentProjector {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Decode a stored value into a JSON object.
     * @return The object, or empty when the value is not JSON or not an object
     */
    public Optional<JsonNode> parseDocument(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Project a document into the view class of the expected content type.
     */
    public Projection<? extends TypedView> project(String key, JsonNode document, ContentType expected) {
        return switch (expected) {
            case LISTING -> projectListing(key, document);
            case USER -> projectUser(key, document);
            case PRODUCT_RATING -> projectProductRating(key, document);
            case SELLER_RATING -> projectSellerRating(key, document);
        };
    }

    public Projection<Listing> projectListing(String key, JsonNode doc) {
        Optional<Projection<Listing>> rejected = checkEnvelope(doc, ContentType.LISTING);
        if (rejected.isPresent()) {
            return rejected.get();
        }
        try {
            JsonNode productNode = doc.get("product");
            if (productNode == null || !productNode.isObject()) {
                throw new MissingField("product");
            }
            Listing listing = new Listing(
                key,
                requireText(doc, "id"),
                requireText(doc, "seller_id"),
                requireInt(doc, "quantity"),
                requireNumber(doc, "price"),
                requireText(doc, "currency"),
                requireText(doc, "condition"),
                requireText(doc, "date"),
                optionalText(doc, "location"),
                optionalInt(doc, "quantity_per_order"),
                optionalText(doc, "expiration_date"),
                stringList(doc, "payment_coins"),
                stringList(doc, "payment_options"),
                stringList(doc, "delivery_options"),
                stringList(doc, "shipping_options"),
                projectProduct(productNode)
            );
            return Projection.valid(listing);
        } catch (MissingField e) {
            return Projection.rejected(Rejection.MISSING_FIELD, e.getMessage());
        }
    }

    public Projection<User> projectUser(String key, JsonNode doc) {
        Optional<Projection<User>> rejected = checkEnvelope(doc, ContentType.USER);
        if (rejected.isPresent()) {
            return rejected.get();
        }
        try {
            String address = requireText(doc, "monero_address");
            User user = new User(
                key,
                address,
                address,
                requireText(doc, "public_key"),
                requireText(doc, "signature"),
                requireText(doc, "created_at"),
                optionalText(doc, "display_name"),
                avatar(doc.get("avatar"))
            );
            return Projection.valid(user);
        } catch (MissingField e) {
            return Projection.rejected(Rejection.MISSING_FIELD, e.getMessage());
        }
    }

    public Projection<ProductRating> projectProductRating(String key, JsonNode doc) {
        Optional<Projection<ProductRating>> rejected = checkEnvelope(doc, ContentType.PRODUCT_RATING);
        if (rejected.isPresent()) {
            return rejected.get();
        }
        try {
            return Projection.valid(new ProductRating(
                key,
                requireText(doc, "rater_id"),
                requireText(doc, "comments"),
                requireText(doc, "signature"),
                requireInt(doc, "stars"),
                optionalText(doc, "expiration_date")
            ));
        } catch (MissingField e) {
            return Projection.rejected(Rejection.MISSING_FIELD, e.getMessage());
        }
    }

    public Projection<SellerRating> projectSellerRating(String key, JsonNode doc) {
        Optional<Projection<SellerRating>> rejected = checkEnvelope(doc, ContentType.SELLER_RATING);
        if (rejected.isPresent()) {
            return rejected.get();
        }
        try {
            return Projection.valid(new SellerRating(
                key,
                requireText(doc, "rater_id"),
                requireText(doc, "comments"),
                requireText(doc, "signature"),
                requireInt(doc, "score")
            ));
        } catch (MissingField e) {
            return Projection.rejected(Rejection.MISSING_FIELD, e.getMessage());
        }
    }

    private Product projectProduct(JsonNode product) {
        List<String> categories = new ArrayList<>();
        categories.add(requireText(product, "category", "product.category"));
        categories.addAll(stringList(product, "subcategories"));

        // attributes is an array of objects; the last weight wins
        Optional<Double> weight = Optional.empty();
        JsonNode attributes = product.get("attributes");
        if (attributes != null && attributes.isArray()) {
            for (JsonNode attribute : attributes) {
                JsonNode w = attribute.get("weight");
                if (attribute.isObject() && w != null && w.isNumber()) {
                    weight = Optional.of(w.asDouble());
                }
            }
        }

        List<ImageRef> images = new ArrayList<>();
        JsonNode imagesNode = product.get("images");
        if (imagesNode != null && imagesNode.isArray()) {
            for (JsonNode image : imagesNode) {
                JsonNode name = image.get("name");
                JsonNode id = image.get("id");
                if (name != null && name.isTextual() && id != null && id.isIntegralNumber()) {
                    images.add(new ImageRef(name.asText(), id.asInt()));
                }
            }
        }

        return new Product(
            requireText(product, "name", "product.name"),
            requireText(product, "description", "product.description"),
            categories,
            weight,
            images,
            optionalText(product, "thumbnail")
        );
    }

    private static Optional<ObjectDescriptor> avatar(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode name = node.get("name");
        JsonNode pieceSize = node.get("piece_size");
        JsonNode size = node.get("size");
        JsonNode pieces = node.get("pieces");
        if (name == null || !name.isTextual()
                || pieceSize == null || !pieceSize.isIntegralNumber()
                || size == null || !size.isIntegralNumber()
                || pieces == null || !pieces.isArray()) {
            return Optional.empty();
        }
        List<String> hashes = new ArrayList<>();
        for (JsonNode piece : pieces) {
            if (piece.isTextual()) {
                hashes.add(piece.asText());
            }
        }
        JsonNode id = node.get("id");
        return Optional.of(new ObjectDescriptor(
            name.asText(),
            size.asLong(),
            pieceSize.asInt(),
            hashes,
            id != null && id.isIntegralNumber() ? id.asInt() : null,
            null
        ));
    }

    private static <T extends TypedView> Optional<Projection<T>> checkEnvelope(JsonNode doc, ContentType expected) {
        if (doc == null || !doc.isObject()) {
            return Optional.of(Projection.rejected(Rejection.MALFORMED_DOCUMENT, "document is not an object"));
        }
        JsonNode metadata = doc.get("metadata");
        if (metadata == null || !metadata.isTextual()) {
            return Optional.of(Projection.rejected(Rejection.METADATA_MISMATCH,
                "\"" + expected.tag() + "\" expected, got no metadata"));
        }
        if (!expected.tag().equals(metadata.asText())) {
            return Optional.of(Projection.rejected(Rejection.METADATA_MISMATCH,
                "\"" + expected.tag() + "\" expected, got \"" + metadata.asText() + "\""));
        }
        return Optional.empty();
    }

    private static String requireText(JsonNode node, String field) {
        return requireText(node, field, field);
    }

    private static String requireText(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MissingField(path);
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MissingField(field);
        }
        return value.asInt();
    }

    private static double requireNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new MissingField(field);
        }
        return value.asDouble();
    }

    private static Optional<String> optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    private static Optional<Integer> optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() && value.canConvertToInt()
            ? Optional.of(value.asInt()) : Optional.empty();
    }

    private static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isTextual()) {
                result.add(item.asText());
            }
        }
        return result;
    }

    private static final class MissingField extends RuntimeException {
        MissingField(String field) {
            super("required field \"" + field + "\" is missing");
        }
    }
}
