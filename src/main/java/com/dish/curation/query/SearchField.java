package com.dish.curation.query;

import com.dish.curation.core.model.CuratedItem;

import java.util.List;
import java.util.function.Function;

/**
 * Fields the search stage can match against. {@link #NAME} is always searched.
 */
public enum SearchField {
    NAME(item -> List.of(item.getName())),
    DESCRIPTION(item -> item.getDescription() != null ? List.of(item.getDescription()) : List.of()),
    INGREDIENTS(CuratedItem::getIngredients),
    MUNICIPALITY(item -> item.getMunicipalityName() != null ? List.of(item.getMunicipalityName()) : List.of());

    private final Function<CuratedItem, List<String>> extractor;

    SearchField(Function<CuratedItem, List<String>> extractor) {
        this.extractor = extractor;
    }

    List<String> valuesOf(CuratedItem item) {
        return extractor.apply(item);
    }
}
