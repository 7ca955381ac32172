package com.propertyintel.listings.migration;

import com.propertyintel.listings.model.Category;

/**
 * The flat, one-row-per-crawl tables the store replaces. The listings table
 * sits on the same name the versioned listings table takes over at cutover.
 */
public record LegacyTables(Category category, String listings, String details, String priceColumn) {

    public static LegacyTables of(Category category) {
        String prefix = category.tablePrefix();
        return new LegacyTables(category, prefix + "_listings", prefix + "_details", category.legacyPriceColumn());
    }
}
