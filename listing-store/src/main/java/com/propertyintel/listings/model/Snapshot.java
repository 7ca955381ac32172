package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Immutable historical state of a listing's volatile fields.
 */
@Data
@Builder
public class Snapshot {

    private long snapshotId;
    private long listingId;

    /** First time this exact content was observed */
    private Instant snapshotTs;

    /** SHA-256 of the canonical volatile fields */
    private String rowHash;

    private VolatileFields fields;
}
