package com.dish.curation.core.model;

import java.util.Objects;

/**
 * Projection of an item on the other side of an association, together with the
 * link metadata.
 *
 * @param id       the item id
 * @param name     the item name
 * @param slug     the item slug, may be null
 * @param kind     the item kind
 * @param category dish category or restaurant kind, may be null
 * @param link     the metadata of the link row
 */
public record LinkedItemRef(long id, String name, String slug, ItemKind kind,
                            String category, LinkMetadata link) {

    public LinkedItemRef {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        link = link != null ? link : LinkMetadata.defaults();
    }
}
