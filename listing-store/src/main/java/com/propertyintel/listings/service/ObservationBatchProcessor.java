package com.propertyintel.listings.service;

import com.propertyintel.listings.model.IngestionBatchResult;
import com.propertyintel.listings.model.RawObservation;
import com.propertyintel.listings.store.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Feeds a crawler batch through {@link ListingIngestionService} one observation at a time.
 *
 * Storage outages that outlast the retry policy are counted and the batch moves on;
 * the failed observations are picked up again on the next crawl. Constraint
 * violations and statements the database rejects outright indicate a bug or a
 * missing schema and stop the batch.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ObservationBatchProcessor {

    private final ListingIngestionService ingestionService;

    public IngestionBatchResult process(List<RawObservation> observations) {
        IngestionBatchResult result = new IngestionBatchResult();
        if (observations == null || observations.isEmpty()) {
            return result;
        }

        log.info("Ingesting batch of {} observations", observations.size());
        for (RawObservation observation : observations) {
            result.setReceived(result.getReceived() + 1);
            try {
                result.record(ingestionService.ingest(observation));
            } catch (StorageUnavailableException e) {
                log.error("Observation {}/{} not stored: {}",
                        observation.getCategory(), observation.getListingId(), e.getMessage(), e);
                result.recordFailure(observation, e.getMessage());
            }
        }

        log.info("Batch done: {} received, {} new snapshots, {} duplicates, {} retired, {} failed",
                result.getReceived(), result.getNewSnapshots(), result.getDuplicates(),
                result.getRetired(), result.getFailed());
        return result;
    }
}
