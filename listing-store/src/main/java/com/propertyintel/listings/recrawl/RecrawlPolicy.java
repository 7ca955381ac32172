package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.model.Category;

import java.time.Instant;

/**
 * Decides when a still-live listing may be crawled again.
 */
public interface RecrawlPolicy {

    /**
     * @param category         offering category of the listing
     * @param observedAt       time of the observation just ingested
     * @param currentStateSince timestamp of the listing's current snapshot, i.e. since
     *                          when its content has been unchanged (may be null)
     */
    Instant nextEligibleAt(Category category, Instant observedAt, Instant currentStateSince);
}
