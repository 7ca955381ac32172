package com.propertyintel.listings.service;

import com.propertyintel.listings.model.IngestionOutcome;
import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.RawObservation;
import com.propertyintel.listings.model.RecrawlEntry;
import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.model.SnapshotRecordResult;
import com.propertyintel.listings.model.VolatileFields;
import com.propertyintel.listings.recrawl.ListingStatusClassifier;
import com.propertyintel.listings.recrawl.RecrawlPolicy;
import com.propertyintel.listings.recrawl.RecrawlScheduler;
import com.propertyintel.listings.store.ListingDimension;
import com.propertyintel.listings.store.SnapshotStore;
import com.propertyintel.listings.store.TableSet;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Applies one crawler observation to the live tables:
 * listing row, snapshot history, current pointer and recrawl queue, in that order.
 *
 * Every step is idempotent, so a retried or replayed observation converges to the
 * same state. Only the newest observation of a listing (observedAt at or after its
 * last_seen_at) moves the recrawl queue, using its own status. An older observation
 * that arrives late is stored as history and leaves the queue as it is, so it can
 * neither revive a retired listing nor retire a relisted one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ListingIngestionService {

    private final ListingDimension listingDimension;
    private final SnapshotStore snapshotStore;
    private final RecrawlScheduler recrawlScheduler;
    private final RecrawlPolicy recrawlPolicy;
    private final ListingStatusClassifier statusClassifier;

    @Retry(name = "listingStore")
    public IngestionOutcome ingest(RawObservation observation) {
        validate(observation);

        long listingId = observation.getListingId();
        TableSet tables = TableSet.live(observation.getCategory());
        VolatileFields fields = observation.getVolatileFields() != null
                ? observation.getVolatileFields()
                : VolatileFields.builder().build();

        Listing listing = listingDimension.upsertListing(
                tables, listingId, observation.getIdentity(), observation.getObservedAt());

        SnapshotRecordResult recorded = snapshotStore.recordObservation(
                tables, listingId, observation.getObservedAt(), fields);

        if (recorded.isNew()) {
            listingDimension.refreshCurrentPointer(tables, listingId);
        }

        IngestionOutcome.IngestionOutcomeBuilder outcome = IngestionOutcome.builder()
                .listingId(listingId)
                .category(observation.getCategory())
                .snapshotId(recorded.snapshotId())
                .newSnapshot(recorded.isNew());

        if (observation.getObservedAt().isBefore(listing.getLastSeenAt())) {
            Optional<RecrawlEntry> entry = recrawlScheduler.findEntry(tables, listingId);
            log.debug("Listing {}/{} observed at {} is older than last seen {}, queue unchanged",
                    tables.category(), listingId, observation.getObservedAt(), listing.getLastSeenAt());
            return outcome
                    .active(entry.isPresent())
                    .nextEligibleAt(entry.map(RecrawlEntry::nextUpdateTs).orElse(null))
                    .build();
        }

        String status = fields.getStatus();
        if (!statusClassifier.isLive(status)) {
            if (recrawlScheduler.markInactive(tables, listingId)) {
                log.info("Listing {}/{} retired (status '{}')", tables.category(), listingId, status);
            }
            return outcome.active(false).build();
        }

        Instant stateSince = snapshotStore.findById(tables, recorded.snapshotId())
                .map(Snapshot::getSnapshotTs)
                .orElse(observation.getObservedAt());
        Instant nextEligibleAt = recrawlPolicy.nextEligibleAt(
                observation.getCategory(), observation.getObservedAt(), stateSince);
        recrawlScheduler.markActive(tables, listingId, nextEligibleAt);

        return outcome.active(true).nextEligibleAt(nextEligibleAt).build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void validate(RawObservation observation) {
        if (observation == null) {
            throw new IllegalArgumentException("observation is required");
        }
        if (observation.getListingId() == null) {
            throw new IllegalArgumentException("listingId is required");
        }
        if (observation.getCategory() == null) {
            throw new IllegalArgumentException("category is required for listing " + observation.getListingId());
        }
        if (observation.getObservedAt() == null) {
            throw new IllegalArgumentException("observedAt is required for listing " + observation.getListingId());
        }
    }
}
