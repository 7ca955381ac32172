package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Dimension row: one per (listing id, category).
 */
@Data
@Builder
public class Listing {

    private long listingId;
    private Category category;
    private IdentityFields identity;

    private Instant firstSeenAt;
    private Instant lastSeenAt;

    /** Weak reference to the latest snapshot; null before the first snapshot */
    private Long currentSnapshotId;
}
