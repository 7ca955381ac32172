package com.propertyintel.listings.migration;

import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.model.SnapshotRecordResult;
import com.propertyintel.listings.recrawl.ListingStatusClassifier;
import com.propertyintel.listings.recrawl.RecrawlPolicy;
import com.propertyintel.listings.recrawl.RecrawlScheduler;
import com.propertyintel.listings.store.ListingDimension;
import com.propertyintel.listings.store.SchemaManager;
import com.propertyintel.listings.store.SnapshotStore;
import com.propertyintel.listings.store.StorageUnavailableException;
import com.propertyintel.listings.store.TableSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves one category from the legacy flat tables to the versioned tables.
 *
 * <ol>
 *   <li>{@link #backfill} fills the {@code new_} staging tables; safe to rerun.</li>
 *   <li>{@link #preflight} compares staged and legacy counts.</li>
 *   <li>{@link #cutover} drops the legacy tables and renames staging to live in one transaction.</li>
 * </ol>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MigrationCoordinator {

    private final SchemaManager schemaManager;
    private final LegacyListingReader legacyReader;
    private final ListingDimension listingDimension;
    private final SnapshotStore snapshotStore;
    private final RecrawlScheduler recrawlScheduler;
    private final RecrawlPolicy recrawlPolicy;
    private final ListingStatusClassifier statusClassifier;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ListingStoreProperties properties;

    /**
     * Copies every legacy row into the staging tables. Listings already staged keep
     * their identity; their snapshots are re-recorded and collapse onto existing rows,
     * so an interrupted run can simply be started again.
     */
    public BackfillReport backfill(Category category) {
        LegacyTables legacy = LegacyTables.of(category);
        TableSet staging = TableSet.staging(category);

        if (!schemaManager.isLegacyFlatTable(legacy.listings())) {
            throw new IllegalStateException("No legacy table " + legacy.listings() + " to migrate (already cut over?)");
        }
        schemaManager.ensureSchema(staging);

        BackfillReport report = new BackfillReport();
        report.setCategory(category);
        report.setStartedAt(Instant.now());
        report.setStatus("RUNNING");
        log.info("Backfill {} -> {} started", legacy.listings(), staging.listings());

        List<LegacyRow> group = new ArrayList<>();
        long rows = legacyReader.stream(legacy, row -> {
            if (row.createdAt() == null) {
                log.warn("Legacy record {} (property {}) has no created_at, skipped", row.recordId(), row.propertyId());
                report.setSkippedRows(report.getSkippedRows() + 1);
                return;
            }
            if (!group.isEmpty() && group.get(0).propertyId() != row.propertyId()) {
                migrateListing(staging, group, report);
                group.clear();
            }
            group.add(row);
        });
        if (!group.isEmpty()) {
            migrateListing(staging, group, report);
        }

        report.setLegacyRows(rows);
        report.setCompletedAt(Instant.now());
        report.setStatus(report.getFailedListings() == 0 ? "SUCCESS" : "PARTIAL");

        log.info("Backfill {} {}: {} rows, {} listings created, {} already staged, {} snapshots, "
                        + "{} duplicates, {} skipped, {} queued, {} failed",
                category, report.getStatus(), rows, report.getListingsCreated(), report.getListingsExisting(),
                report.getSnapshotsCreated(), report.getDuplicateRows(), report.getSkippedRows(),
                report.getQueued(), report.getFailedListings());
        return report;
    }

    public CutoverPreflight preflight(Category category) {
        LegacyTables legacy = LegacyTables.of(category);
        TableSet staging = TableSet.staging(category);
        TableSet live = TableSet.live(category);

        CutoverPreflight check = new CutoverPreflight();
        check.setCategory(category);
        check.setLegacyPresent(schemaManager.isLegacyFlatTable(legacy.listings()));
        check.setStagingPresent(staging.tables().stream().allMatch(schemaManager::tableExists));
        check.setLiveNamesFree(!schemaManager.tableExists(live.snapshots()) && !schemaManager.tableExists(live.active()));

        if (!check.isLegacyPresent()) {
            check.problem("legacy table " + legacy.listings() + " not found");
        }
        if (!check.isStagingPresent()) {
            check.problem("staging tables " + staging.tables() + " missing, run the backfill first");
        }
        if (!check.isLiveNamesFree()) {
            check.problem("live table names " + live.snapshots() + "/" + live.active() + " already in use");
        }
        if (!check.isLegacyPresent() || !check.isStagingPresent()) {
            return check;
        }

        check.setLegacyRows(legacyReader.countRows(legacy));
        check.setLegacyListings(legacyReader.countDistinctListings(legacy));
        check.setStagedListings(listingDimension.countListings(staging));
        check.setStagedSnapshots(snapshotStore.countSnapshots(staging));
        check.setStagedWithoutCurrentSnapshot(listingDimension.countWithoutCurrentSnapshot(staging));
        check.setStagedQueued(recrawlScheduler.countActive(staging));

        if (check.getStagedListings() != check.getLegacyListings()) {
            check.problem("staged %d listings, legacy has %d".formatted(
                    check.getStagedListings(), check.getLegacyListings()));
        }
        if (check.getStagedSnapshots() < check.getStagedListings()
                || check.getStagedSnapshots() > check.getLegacyRows()) {
            check.problem("staged %d snapshots, expected between %d and %d".formatted(
                    check.getStagedSnapshots(), check.getStagedListings(), check.getLegacyRows()));
        }
        if (check.getStagedWithoutCurrentSnapshot() > 0) {
            check.problem(check.getStagedWithoutCurrentSnapshot() + " staged listings have no current snapshot");
        }

        log.info("Preflight {}: {}", category, check.isReady() ? "ready" : check.getProblems());
        return check;
    }

    /**
     * Drops the legacy tables and renames the staging tables, constraints and
     * indexes to their live names. Destructive: requires a confirmed backup.
     *
     * @throws IllegalStateException         when not confirmed or preflight fails (nothing changed)
     * @throws FatalMigrationStateException  when the swap itself fails
     */
    public CutoverResult cutover(Category category, boolean backupConfirmed) {
        if (!backupConfirmed) {
            throw new IllegalStateException("Cutover of " + category + " drops the legacy tables; confirm a backup first");
        }
        CutoverPreflight check = preflight(category);
        if (!check.isReady()) {
            throw new IllegalStateException("Cutover of " + category + " refused: " + check.getProblems());
        }

        LegacyTables legacy = LegacyTables.of(category);
        TableSet staging = TableSet.staging(category);
        TableSet live = TableSet.live(category);

        log.warn("Cutover {}: dropping {} and {}, promoting {}", category,
                legacy.details(), legacy.listings(), staging.tables());
        try {
            transactionTemplate.executeWithoutResult(tx -> {
                jdbcTemplate.execute("DROP TABLE IF EXISTS " + legacy.details());
                jdbcTemplate.execute("DROP TABLE " + legacy.listings());

                renameTable(staging.listings(), live.listings());
                renameTable(staging.snapshots(), live.snapshots());
                renameTable(staging.active(), live.active());

                renameConstraint(live.listings(), staging.listingsPk(), live.listingsPk());
                renameConstraint(live.listings(), staging.currentSnapshotFk(), live.currentSnapshotFk());
                renameConstraint(live.snapshots(), staging.snapshotsPk(), live.snapshotsPk());
                renameConstraint(live.snapshots(), staging.snapshotHashUnique(), live.snapshotHashUnique());
                renameConstraint(live.snapshots(), staging.snapshotListingFk(), live.snapshotListingFk());
                renameConstraint(live.active(), staging.activePk(), live.activePk());
                renameConstraint(live.active(), staging.activeListingFk(), live.activeListingFk());

                renameIndex(staging.snapshotLatestIndex(), live.snapshotLatestIndex());
                renameIndex(staging.activeNextUpdateIndex(), live.activeNextUpdateIndex());
            });
        } catch (RuntimeException e) {
            log.error("Cutover of {} failed, database needs manual inspection: {}", category, e.getMessage(), e);
            throw new FatalMigrationStateException("Cutover of " + category + " failed", e);
        }

        CutoverResult result = new CutoverResult(category, live.tables(),
                listingDimension.countListings(live), snapshotStore.countSnapshots(live), Instant.now());
        log.info("Cutover {} complete: {} listings, {} snapshots now live",
                category, result.listings(), result.snapshots());
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void migrateListing(TableSet staging, List<LegacyRow> rows, BackfillReport report) {
        LegacyRow first = rows.get(0);
        LegacyRow last = rows.get(rows.size() - 1);
        long listingId = first.propertyId();

        try {
            boolean created = listingDimension.insertListingIfAbsent(
                    staging, listingId, first.identity(), first.createdAt(), last.createdAt());
            if (created) {
                report.setListingsCreated(report.getListingsCreated() + 1);
            } else {
                listingDimension.extendLastSeen(staging, listingId, last.createdAt());
                report.setListingsExisting(report.getListingsExisting() + 1);
            }

            SnapshotRecordResult newest = null;
            for (LegacyRow row : rows) {
                newest = snapshotStore.recordObservation(staging, listingId, row.createdAt(), row.fields());
                if (newest.isNew()) {
                    report.setSnapshotsCreated(report.getSnapshotsCreated() + 1);
                } else {
                    report.setDuplicateRows(report.getDuplicateRows() + 1);
                }
            }

            listingDimension.refreshCurrentPointer(staging, listingId);

            if (properties.getMigration().isSeedRecrawlQueue()) {
                seedQueue(staging, listingId, last, newest, report);
            }
        } catch (StorageUnavailableException e) {
            log.error("Backfill of listing {} failed, rerun the backfill to complete it: {}",
                    listingId, e.getMessage(), e);
            report.setFailedListings(report.getFailedListings() + 1);
        }
    }

    /**
     * Queue state follows the newest legacy crawl, the same rule live ingestion applies.
     */
    private void seedQueue(TableSet staging, long listingId, LegacyRow last, SnapshotRecordResult newest,
                           BackfillReport report) {
        if (!statusClassifier.isLive(last.fields().getStatus())) {
            recrawlScheduler.markInactive(staging, listingId);
            return;
        }
        Instant stateSince = snapshotStore.findById(staging, newest.snapshotId())
                .map(Snapshot::getSnapshotTs)
                .orElse(last.createdAt());
        Instant next = recrawlPolicy.nextEligibleAt(staging.category(), last.createdAt(), stateSince);
        if (recrawlScheduler.markActive(staging, listingId, next)) {
            report.setQueued(report.getQueued() + 1);
        }
    }

    private void renameTable(String from, String to) {
        jdbcTemplate.execute("ALTER TABLE %s RENAME TO %s".formatted(from, to));
    }

    private void renameConstraint(String table, String from, String to) {
        jdbcTemplate.execute("ALTER TABLE %s RENAME CONSTRAINT %s TO %s".formatted(table, from, to));
    }

    private void renameIndex(String from, String to) {
        jdbcTemplate.execute("ALTER INDEX IF EXISTS %s RENAME TO %s".formatted(from, to));
    }
}
