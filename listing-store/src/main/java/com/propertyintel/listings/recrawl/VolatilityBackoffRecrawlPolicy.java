package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.Category;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Polls stable listings less often: the wait equals how long the current
 * content has been unchanged, clamped to [category interval, max interval].
 * A listing that just changed is back on the base interval.
 */
@RequiredArgsConstructor
public class VolatilityBackoffRecrawlPolicy implements RecrawlPolicy {

    private final ListingStoreProperties.Recrawl settings;

    @Override
    public Instant nextEligibleAt(Category category, Instant observedAt, Instant currentStateSince) {
        Duration base = settings.intervalFor(category);
        Duration max = settings.getMaxInterval().compareTo(base) < 0 ? base : settings.getMaxInterval();

        Duration stableFor = currentStateSince == null || currentStateSince.isAfter(observedAt)
                ? Duration.ZERO
                : Duration.between(currentStateSince, observedAt);

        Duration wait = stableFor;
        if (wait.compareTo(base) < 0) {
            wait = base;
        }
        if (wait.compareTo(max) > 0) {
            wait = max;
        }
        return observedAt.plus(wait);
    }
}
