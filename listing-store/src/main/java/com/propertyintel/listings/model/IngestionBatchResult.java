package com.propertyintel.listings.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters for one batch of observations, similar to a scrape run summary.
 */
@Data
public class IngestionBatchResult {

    private int received;
    private int newSnapshots;
    private int duplicates;
    private int retired;
    private int failed;

    /** "category/listingId: message" for observations that could not be stored */
    private List<String> failures = new ArrayList<>();

    public void record(IngestionOutcome outcome) {
        if (outcome.isNewSnapshot()) {
            newSnapshots++;
        } else {
            duplicates++;
        }
        if (!outcome.isActive()) {
            retired++;
        }
    }

    public void recordFailure(RawObservation observation, String message) {
        failed++;
        failures.add(observation.getCategory() + "/" + observation.getListingId() + ": " + message);
    }
}
