package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.Category;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * observedAt + per-category interval. Default policy.
 */
@RequiredArgsConstructor
public class FixedIntervalRecrawlPolicy implements RecrawlPolicy {

    private final ListingStoreProperties.Recrawl settings;

    @Override
    public Instant nextEligibleAt(Category category, Instant observedAt, Instant currentStateSince) {
        return observedAt.plus(settings.intervalFor(category));
    }
}
