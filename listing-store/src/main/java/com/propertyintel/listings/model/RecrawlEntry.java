package com.propertyintel.listings.model;

import java.time.Instant;

/**
 * Work queue row. Present only while the listing should still be crawled.
 */
public record RecrawlEntry(long listingId, Instant nextUpdateTs) {
}
