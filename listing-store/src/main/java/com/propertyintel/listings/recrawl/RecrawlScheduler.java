package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.RecrawlEntry;
import com.propertyintel.listings.store.DatabaseDialect;
import com.propertyintel.listings.store.StoreErrorTranslator;
import com.propertyintel.listings.store.TableSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Recrawl work queue. A row in the active table is the only signal that a
 * listing should be crawled again; its timestamp says when.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class RecrawlScheduler {

    private final NamedParameterJdbcTemplate jdbc;
    private final DatabaseDialect dialect;
    private final ListingStoreProperties properties;

    /**
     * Inserts or moves the entry so the listing is due no earlier than {@code nextEligibleAt}.
     *
     * @return false if the listing row does not exist (nothing scheduled)
     */
    public boolean markActive(TableSet tables, long listingId, Instant nextEligibleAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("listingId", listingId)
                .addValue("nextUpdateTs", Timestamp.from(nextEligibleAt));

        // Selecting from the listings table schedules nothing when the listing is missing
        String source = """
                SELECT CAST(:listingId AS BIGINT), CAST(:nextUpdateTs AS TIMESTAMP WITH TIME ZONE)
                FROM %s
                WHERE listing_id = :listingId
                """.formatted(tables.listings());

        String sql = dialect.isPostgres()
                ? """
                  INSERT INTO %s (listing_id, next_update_ts)
                  %s
                  ON CONFLICT (listing_id) DO UPDATE SET next_update_ts = EXCLUDED.next_update_ts
                  """.formatted(tables.active(), source)
                : """
                  MERGE INTO %s (listing_id, next_update_ts)
                  KEY (listing_id)
                  %s
                  """.formatted(tables.active(), source);

        try {
            int rows = jdbc.update(sql, params);
            if (rows == 0) {
                log.warn("Listing {} not found in {}, recrawl not scheduled", listingId, tables.listings());
                return false;
            }
            log.debug("Listing {} due for recrawl at {}", listingId, nextEligibleAt);
            return true;
        } catch (DataIntegrityViolationException e) {
            // Listing deleted between the select and the write
            log.warn("Listing {} vanished while scheduling recrawl: {}", listingId, e.getMessage());
            return false;
        } catch (DataAccessException e) {
            throw StoreErrorTranslator.translate("markActive " + listingId, e);
        }
    }

    /**
     * Retires the listing from the queue. No-op if it is already inactive.
     *
     * @return true if an entry was removed
     */
    public boolean markInactive(TableSet tables, long listingId) {
        int removed = StoreErrorTranslator.execute("markInactive " + listingId, () -> jdbc.update(
                "DELETE FROM %s WHERE listing_id = :listingId".formatted(tables.active()),
                new MapSqlParameterSource("listingId", listingId)));
        if (removed > 0) {
            log.debug("Listing {} retired from recrawl queue {}", listingId, tables.active());
        }
        return removed > 0;
    }

    /**
     * Listings due at {@code asOf}, oldest-due first, at most {@code limit}.
     * Nothing is read until iteration starts and every new iterator re-reads the queue.
     */
    public DueListings dueForRecrawl(TableSet tables, Instant asOf, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        return new DueListings(jdbc, tables, asOf, limit, Math.max(1, properties.getRecrawl().getPageSize()));
    }

    public Optional<RecrawlEntry> findEntry(TableSet tables, long listingId) {
        List<RecrawlEntry> rows = StoreErrorTranslator.execute("findRecrawlEntry " + listingId, () -> jdbc.query(
                "SELECT listing_id, next_update_ts FROM %s WHERE listing_id = :listingId".formatted(tables.active()),
                new MapSqlParameterSource("listingId", listingId),
                (rs, rowNum) -> new RecrawlEntry(rs.getLong("listing_id"), rs.getTimestamp("next_update_ts").toInstant())));
        return rows.stream().findFirst();
    }

    public long countDue(TableSet tables, Instant asOf) {
        Long count = StoreErrorTranslator.execute("countDue " + tables.active(), () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM %s WHERE next_update_ts <= :asOf".formatted(tables.active()),
                new MapSqlParameterSource("asOf", Timestamp.from(asOf)),
                Long.class));
        return count == null ? 0 : count;
    }

    public long countActive(TableSet tables) {
        Long count = StoreErrorTranslator.execute("countActive " + tables.active(), () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + tables.active(), new MapSqlParameterSource(), Long.class));
        return count == null ? 0 : count;
    }
}
