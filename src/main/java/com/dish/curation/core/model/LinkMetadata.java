package com.dish.curation.core.model;

/**
 * Optional metadata carried by a dish-restaurant link.
 *
 * @param priceNote    free-form price note, may be null
 * @param availability how the dish is offered, defaults to {@link Availability#REGULAR}
 */
public record LinkMetadata(String priceNote, Availability availability) {

    public LinkMetadata {
        availability = availability != null ? availability : Availability.REGULAR;
        priceNote = priceNote != null && !priceNote.isBlank() ? priceNote.trim() : null;
    }

    public static LinkMetadata defaults() {
        return new LinkMetadata(null, Availability.REGULAR);
    }

    public static LinkMetadata of(String priceNote, Availability availability) {
        return new LinkMetadata(priceNote, availability);
    }
}
