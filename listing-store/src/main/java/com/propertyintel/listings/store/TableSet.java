package com.propertyintel.listings.store;

import com.propertyintel.listings.model.Category;

import java.util.List;

/**
 * Names of the three versioned tables for one category.
 * Live tables are what the application reads; staging tables carry the
 * {@code new_} prefix while a migration backfill is in progress.
 *
 * Table names are only ever derived from {@link Category}, never from input,
 * so they are safe to splice into SQL.
 */
public record TableSet(Category category, String listings, String snapshots, String active) {

    private static final String STAGING_PREFIX = "new_";

    public static TableSet live(Category category) {
        String prefix = category.tablePrefix();
        return new TableSet(category,
                prefix + "_listings",
                prefix + "_listing_snapshots",
                "active_" + prefix + "_listings");
    }

    public static TableSet staging(Category category) {
        TableSet live = live(category);
        return new TableSet(category,
                STAGING_PREFIX + live.listings(),
                STAGING_PREFIX + live.snapshots(),
                STAGING_PREFIX + live.active());
    }

    public List<String> tables() {
        return List.of(listings, snapshots, active);
    }

    // ── Constraint and index names (derived so cutover can rename them) ──────

    public String listingsPk() {
        return "pk_" + listings;
    }

    public String snapshotsPk() {
        return "pk_" + snapshots;
    }

    public String activePk() {
        return "pk_" + active;
    }

    public String snapshotListingFk() {
        return "fk_" + snapshots + "_listing";
    }

    public String snapshotHashUnique() {
        return "uq_" + snapshots + "_hash";
    }

    public String currentSnapshotFk() {
        return "fk_" + listings + "_current_snapshot";
    }

    public String activeListingFk() {
        return "fk_" + active + "_listing";
    }

    public String snapshotLatestIndex() {
        return "idx_" + snapshots + "_latest";
    }

    public String activeNextUpdateIndex() {
        return "idx_" + active + "_next_update";
    }
}
