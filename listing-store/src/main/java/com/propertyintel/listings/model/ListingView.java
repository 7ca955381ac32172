package com.propertyintel.listings.model;

/**
 * A listing together with its resolved current snapshot (null if none yet).
 */
public record ListingView(Listing listing, Snapshot currentSnapshot) {
}
