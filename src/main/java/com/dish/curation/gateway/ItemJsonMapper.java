package com.dish.curation.gateway;

import com.dish.curation.core.model.Availability;
import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.Municipality;
import com.dish.curation.core.model.RankScope;
import com.dish.curation.core.model.SpiceLevel;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps rows of the REST API into model objects.
 *
 * <p>Column names follow the SQL store: dishes carry {@code panel_rank} and
 * {@code is_signature}, restaurants carry {@code featured_rank} and {@code featured}.
 * A stored rank of 0 or outside 1..3 is read as unranked.</p>
 */
class ItemJsonMapper {

    static final String DISH_RANK_FIELD = "panel_rank";
    static final String DISH_FLAG_FIELD = "is_signature";
    static final String RESTAURANT_RANK_FIELD = "featured_rank";
    static final String RESTAURANT_FLAG_FIELD = "featured";

    private final ListFieldNormalizer listNormalizer;

    ItemJsonMapper(ListFieldNormalizer listNormalizer) {
        this.listNormalizer = listNormalizer;
    }

    CuratedItem toItem(ItemKind kind, JsonNode row) {
        CuratedItem.Builder builder = CuratedItem.builder()
                .kind(kind)
                .id(row.path("id").asLong())
                .name(row.path("name").asText(""))
                .slug(text(row, "slug"))
                .municipalityId(row.path("municipality_id").asLong(0))
                .municipalityName(text(row, "municipality_name"))
                .description(text(row, "description"))
                .rating(firstNumber(row, "avg_rating", "rating"))
                .ratingCount((long) firstNumber(row, "total_ratings", "review_count"))
                .popularity((long) firstNumber(row, "popularity", "view_count"))
                .price(firstNumber(row, "price", "avg_price"));

        Integer rank;
        Boolean flag;
        if (kind == ItemKind.DISH) {
            builder.category(text(row, "category"))
                    .ingredients(listNormalizer.normalize(row.get("ingredients")))
                    .dietaryTags(listNormalizer.normalize(row.get("dietary_info")));
            SpiceLevel.fromValue(text(row, "spicy_level")).ifPresent(builder::spiceLevel);
            rank = rank(row, DISH_RANK_FIELD);
            flag = bool(row, DISH_FLAG_FIELD, "signature");
        } else {
            builder.category(text(row, "kind"))
                    .ingredients(listNormalizer.normalize(row.get("cuisine_types")));
            rank = rank(row, RESTAURANT_RANK_FIELD);
            if (rank == null) {
                rank = rank(row, DISH_RANK_FIELD);
            }
            flag = bool(row, RESTAURANT_FLAG_FIELD, "is_featured");
        }
        builder.rank(rank);
        builder.flag(flag != null ? flag : rank != null);
        return builder.build();
    }

    LinkedItemRef toLinkedRef(ItemKind kind, JsonNode row) {
        LinkMetadata metadata = new LinkMetadata(
                text(row, "price_note"),
                Availability.fromValue(text(row, "availability")));
        return new LinkedItemRef(
                row.path("id").asLong(),
                row.path("name").asText(""),
                text(row, "slug"),
                kind,
                text(row, kind == ItemKind.DISH ? "category" : "kind"),
                metadata);
    }

    Municipality toMunicipality(JsonNode row) {
        return new Municipality(row.path("id").asLong(), row.path("name").asText(""), text(row, "slug"));
    }

    static String rankField(ItemKind kind) {
        return kind == ItemKind.DISH ? DISH_RANK_FIELD : RESTAURANT_RANK_FIELD;
    }

    static String flagField(ItemKind kind) {
        return kind == ItemKind.DISH ? DISH_FLAG_FIELD : RESTAURANT_FLAG_FIELD;
    }

    private static Integer rank(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        int value = node.asInt(0);
        return value >= 1 && value <= RankScope.SLOT_COUNT ? value : null;
    }

    private static Boolean bool(JsonNode row, String... fields) {
        for (String field : fields) {
            JsonNode node = row.get(field);
            if (node != null && !node.isNull()) {
                return node.isBoolean() ? node.booleanValue() : node.asInt(0) != 0;
            }
        }
        return null;
    }

    private static double firstNumber(JsonNode row, String... fields) {
        for (String field : fields) {
            JsonNode node = row.get(field);
            if (node != null && !node.isNull()) {
                return node.asDouble(0);
            }
        }
        return 0;
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
