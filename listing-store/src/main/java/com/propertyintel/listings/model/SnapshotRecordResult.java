package com.propertyintel.listings.model;

/**
 * Outcome of recording an observation. {@code isNew == false} means the content
 * was already stored and the call was ignored.
 */
public record SnapshotRecordResult(long snapshotId, boolean isNew, String fingerprint) {
}
