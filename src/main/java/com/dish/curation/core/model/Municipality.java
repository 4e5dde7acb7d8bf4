package com.dish.curation.core.model;

import java.util.Objects;

/**
 * A municipality that curated items belong to. Referenced by id, never mutated here.
 *
 * @param id   the municipality id
 * @param name the display name
 * @param slug the URL slug
 */
public record Municipality(long id, String name, String slug) {

    public Municipality {
        Objects.requireNonNull(name, "name is required");
        slug = slug != null ? slug : name.toLowerCase().replace(' ', '-');
    }
}
