package io.marketnode.catalog.model;

import io.marketnode.storage.piece.ObjectDescriptor;

import java.util.Optional;

/**
 * Public profile of a marketplace user. The user id is the account's payment address.
 */
public record User(
    String key,
    String userId,
    String moneroAddress,
    String publicKey,
    String signature,
    String createdAt,
    Optional<String> displayName,
    Optional<ObjectDescriptor> avatar
) implements TypedView {

    @Override
    public ContentType contentType() {
        return ContentType.USER;
    }

    /**
     * Display name when set, user id otherwise.
     */
    public String displayNameOrId() {
        return displayName.filter(name -> !name.isEmpty()).orElse(userId);
    }
}
