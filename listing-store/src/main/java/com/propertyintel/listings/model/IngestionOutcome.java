package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * What a single ingested observation changed.
 */
@Data
@Builder
public class IngestionOutcome {

    private long listingId;
    private Category category;
    private long snapshotId;

    /** false when the content was a duplicate of a stored snapshot */
    private boolean newSnapshot;

    /** false when the listing was retired from the recrawl queue */
    private boolean active;

    /** null when inactive */
    private Instant nextEligibleAt;
}
