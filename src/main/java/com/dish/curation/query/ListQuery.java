package com.dish.curation.query;

import java.util.EnumSet;
import java.util.Set;

/**
 * Search text, searched fields, filter and sort order of a list view.
 */
public final class ListQuery {

    private final String text;
    private final Set<SearchField> searchFields;
    private final ItemFilter filter;
    private final SortKey sortKey;

    private ListQuery(Builder builder) {
        this.text = builder.text != null ? builder.text.trim() : "";
        EnumSet<SearchField> fields = EnumSet.copyOf(builder.searchFields);
        fields.add(SearchField.NAME);
        this.searchFields = Set.copyOf(fields);
        this.filter = builder.filter != null ? builder.filter : ItemFilter.none();
        this.sortKey = builder.sortKey != null ? builder.sortKey : SortKey.POPULARITY;
    }

    /**
     * No search text, no filter, popularity order.
     */
    public static ListQuery defaults() {
        return builder().build();
    }

    public String getText() {
        return text;
    }

    public Set<SearchField> getSearchFields() {
        return searchFields;
    }

    public ItemFilter getFilter() {
        return filter;
    }

    public SortKey getSortKey() {
        return sortKey;
    }

    public Builder toBuilder() {
        return new Builder()
                .text(text)
                .searchFields(searchFields)
                .filter(filter)
                .sortKey(sortKey);
    }

    @Override
    public String toString() {
        return "ListQuery{text='" + text + "', fields=" + searchFields +
                ", filter=" + filter + ", sort=" + sortKey + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private final Set<SearchField> searchFields = EnumSet.of(SearchField.NAME);
        private ItemFilter filter;
        private SortKey sortKey;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        /**
         * Replaces the optional searched fields. {@link SearchField#NAME} stays enabled.
         */
        public Builder searchFields(Set<SearchField> fields) {
            searchFields.clear();
            searchFields.add(SearchField.NAME);
            searchFields.addAll(fields);
            return this;
        }

        public Builder searchField(SearchField field) {
            searchFields.add(field);
            return this;
        }

        /**
         * Enables every optional field: description, ingredients and municipality name.
         */
        public Builder searchAllFields() {
            searchFields.addAll(EnumSet.allOf(SearchField.class));
            return this;
        }

        public Builder filter(ItemFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder sortKey(SortKey sortKey) {
            this.sortKey = sortKey;
            return this;
        }

        public ListQuery build() {
            return new ListQuery(this);
        }
    }
}
