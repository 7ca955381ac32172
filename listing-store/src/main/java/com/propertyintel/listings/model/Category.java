package com.propertyintel.listings.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Offering category. Rent and buy listings live in separate table namespaces,
 * so the same listing id may exist once per category.
 */
public enum Category {

    RENT("rent", "rent_price"),
    BUY("buy", "asking_price");

    private final String tablePrefix;
    private final String legacyPriceColumn;

    Category(String tablePrefix, String legacyPriceColumn) {
        this.tablePrefix = tablePrefix;
        this.legacyPriceColumn = legacyPriceColumn;
    }

    public String tablePrefix() {
        return tablePrefix;
    }

    /** Price column name in the legacy flat listings table. */
    public String legacyPriceColumn() {
        return legacyPriceColumn;
    }

    /**
     * Lenient parse used by the REST layer and JSON binding: accepts "rent", "RENT", " Buy ".
     */
    @JsonCreator
    public static Category parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("category must be rent or buy");
        }
        try {
            return Category.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown category: " + value + " (expected rent or buy)");
        }
    }
}
