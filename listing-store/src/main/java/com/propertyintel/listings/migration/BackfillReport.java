package com.propertyintel.listings.migration;

import com.propertyintel.listings.model.Category;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of one backfill run into the staging tables.
 */
@Data
public class BackfillReport {

    private Category category;
    private Instant startedAt;
    private Instant completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL

    private long legacyRows;
    private long skippedRows;       // no created_at
    private long listingsCreated;
    private long listingsExisting;  // already staged by an earlier run
    private long snapshotsCreated;
    private long duplicateRows;     // collapsed onto an existing snapshot
    private long queued;
    private long failedListings;
}
