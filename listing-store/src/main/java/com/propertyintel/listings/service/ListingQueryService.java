package com.propertyintel.listings.service;

import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.model.ListingView;
import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.recrawl.RecrawlScheduler;
import com.propertyintel.listings.store.ListingDimension;
import com.propertyintel.listings.store.SnapshotStore;
import com.propertyintel.listings.store.TableSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side over the live tables.
 */
@Service
@RequiredArgsConstructor
public class ListingQueryService {

    private final ListingDimension listingDimension;
    private final SnapshotStore snapshotStore;
    private final RecrawlScheduler recrawlScheduler;

    public Optional<ListingView> findListing(Category category, long listingId) {
        TableSet tables = TableSet.live(category);
        return listingDimension.findListing(tables, listingId)
                .map(listing -> new ListingView(listing, resolveCurrent(tables, listing.getCurrentSnapshotId())));
    }

    public List<Snapshot> history(Category category, long listingId) {
        return snapshotStore.history(TableSet.live(category), listingId);
    }

    public List<Long> dueForRecrawl(Category category, Instant asOf, int limit) {
        return recrawlScheduler.dueForRecrawl(TableSet.live(category), asOf, limit).toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Snapshot resolveCurrent(TableSet tables, Long snapshotId) {
        if (snapshotId == null) {
            return null;
        }
        return snapshotStore.findById(tables, snapshotId).orElse(null);
    }
}
