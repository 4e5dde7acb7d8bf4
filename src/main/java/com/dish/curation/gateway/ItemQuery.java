package com.dish.curation.gateway;

import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.RankScope;

import java.util.Objects;

/**
 * Server-side filters for {@link RemoteDataGateway#fetchItems(ItemQuery)}.
 *
 * @param kind           the item kind to fetch
 * @param municipalityId restrict to a municipality, null for all
 * @param category       restrict dishes to a category, null for all
 * @param text           server-side text query, null for none
 * @param flaggedOnly    only signature dishes / featured restaurants
 * @param limit          maximum rows, 0 for the server default
 */
public record ItemQuery(ItemKind kind, Long municipalityId, String category, String text,
                        boolean flaggedOnly, int limit) {

    public ItemQuery {
        Objects.requireNonNull(kind, "kind is required");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        if (kind == ItemKind.RESTAURANT) {
            category = null;
        }
        text = text != null && !text.isBlank() ? text.trim() : null;
    }

    public static ItemQuery all(ItemKind kind) {
        return new ItemQuery(kind, null, null, null, false, 0);
    }

    public static ItemQuery inMunicipality(ItemKind kind, long municipalityId) {
        return new ItemQuery(kind, municipalityId, null, null, false, 0);
    }

    /**
     * Query returning every item sharing the given rank scope.
     */
    public static ItemQuery forScope(RankScope scope) {
        return new ItemQuery(scope.kind(), scope.municipalityId(), scope.category(), null, false, 0);
    }

    public ItemQuery withText(String newText) {
        return new ItemQuery(kind, municipalityId, category, newText, flaggedOnly, limit);
    }

    public ItemQuery withCategory(String newCategory) {
        return new ItemQuery(kind, municipalityId, newCategory, text, flaggedOnly, limit);
    }

    public ItemQuery onlyFlagged() {
        return new ItemQuery(kind, municipalityId, category, text, true, limit);
    }

    public ItemQuery withLimit(int newLimit) {
        return new ItemQuery(kind, municipalityId, category, text, flaggedOnly, newLimit);
    }
}
