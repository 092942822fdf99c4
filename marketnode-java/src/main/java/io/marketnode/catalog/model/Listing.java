package io.marketnode.catalog.model;

import java.util.List;
import java.util.Optional;

public record Listing(
    String key,
    String listingId,
    String sellerId,
    int quantity,
    double price,
    String currency,
    String condition,
    String date,
    Optional<String> location,
    Optional<Integer> quantityPerOrder,
    Optional<String> expirationDate,
    List<String> paymentCoins,
    List<String> paymentOptions,
    List<String> deliveryOptions,
    List<String> shippingOptions,
    Product product
) implements TypedView {

    public Listing {
        paymentCoins = List.copyOf(paymentCoins);
        paymentOptions = List.copyOf(paymentOptions);
        deliveryOptions = List.copyOf(deliveryOptions);
        shippingOptions = List.copyOf(shippingOptions);
    }

    @Override
    public ContentType contentType() {
        return ContentType.LISTING;
    }

    public String productName() {
        return product.name();
    }

    public List<String> categories() {
        return product.categories();
    }
}
