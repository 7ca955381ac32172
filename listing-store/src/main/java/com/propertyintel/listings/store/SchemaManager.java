package com.propertyintel.listings.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the versioned tables for a {@link TableSet}. Every statement is
 * idempotent so this can run on every startup and before every backfill.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    private final JdbcTemplate jdbcTemplate;
    private final DatabaseDialect dialect;

    public void ensureSchema(TableSet tables) {
        log.info("Ensuring listing schema exists: {}", tables.tables());

        StoreErrorTranslator.run("ensureSchema " + tables.listings(), () -> {
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s
                (
                    listing_id              BIGINT NOT NULL,
                    address_country         VARCHAR(50),
                    address_province        VARCHAR(100),
                    address_city            VARCHAR(100),
                    address_municipality    VARCHAR(100),
                    address_district        VARCHAR(100),
                    address_neighbourhood   VARCHAR(100),
                    address_street          VARCHAR(255),
                    address_number          VARCHAR(20),
                    address_suffix          VARCHAR(50),
                    address_postal_code     VARCHAR(20),
                    address_is_bag          BOOLEAN,
                    latitude                NUMERIC(10, 7),
                    longitude               NUMERIC(10, 7),
                    property_type           VARCHAR(100),
                    construction_year       INTEGER,
                    first_seen_at           TIMESTAMP WITH TIME ZONE NOT NULL,
                    last_seen_at            TIMESTAMP WITH TIME ZONE NOT NULL,
                    current_snapshot_id     BIGINT,
                    CONSTRAINT %s PRIMARY KEY (listing_id)
                )
                """.formatted(tables.listings(), tables.listingsPk()));

            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s
                (
                    snapshot_id             BIGINT GENERATED BY DEFAULT AS IDENTITY,
                    listing_id              BIGINT NOT NULL,
                    snapshot_ts             TIMESTAMP WITH TIME ZONE NOT NULL,
                    row_hash                VARCHAR(64) NOT NULL,
                    status                  VARCHAR(100),
                    price                   NUMERIC(12, 2),
                    floor_area              NUMERIC(10, 2),
                    plot_area               NUMERIC(10, 2),
                    number_of_rooms         INTEGER,
                    number_of_bedrooms      INTEGER,
                    energy_label            VARCHAR(10),
                    details_json            %s,
                    CONSTRAINT %s PRIMARY KEY (snapshot_id),
                    CONSTRAINT %s UNIQUE (listing_id, row_hash),
                    CONSTRAINT %s FOREIGN KEY (listing_id)
                        REFERENCES %s (listing_id) ON DELETE CASCADE
                )
                """.formatted(tables.snapshots(), dialect.jsonColumnType(), tables.snapshotsPk(),
                    tables.snapshotHashUnique(), tables.snapshotListingFk(), tables.listings()));

            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s
                (
                    listing_id              BIGINT NOT NULL,
                    next_update_ts          TIMESTAMP WITH TIME ZONE NOT NULL,
                    CONSTRAINT %s PRIMARY KEY (listing_id),
                    CONSTRAINT %s FOREIGN KEY (listing_id)
                        REFERENCES %s (listing_id) ON DELETE CASCADE
                )
                """.formatted(tables.active(), tables.activePk(), tables.activeListingFk(), tables.listings()));

            // Added separately: the listing and snapshot tables reference each other
            if (!constraintExists(tables.listings(), tables.currentSnapshotFk())) {
                jdbcTemplate.execute("""
                    ALTER TABLE %s
                        ADD CONSTRAINT %s FOREIGN KEY (current_snapshot_id)
                        REFERENCES %s (snapshot_id) ON DELETE SET NULL
                    """.formatted(tables.listings(), tables.currentSnapshotFk(), tables.snapshots()));
            }

            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s ON %s (listing_id, snapshot_ts DESC)"
                    .formatted(tables.snapshotLatestIndex(), tables.snapshots()));
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s ON %s (next_update_ts)"
                    .formatted(tables.activeNextUpdateIndex(), tables.active()));
        });

        log.info("Listing schema ready: {}", tables.listings());
    }

    public boolean tableExists(String table) {
        Integer count = StoreErrorTranslator.execute("tableExists " + table, () -> jdbcTemplate.queryForObject("""
                SELECT COUNT(*)
                FROM information_schema.tables
                WHERE LOWER(table_name) = LOWER(?)
                  AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)
                """, Integer.class, table));
        return count != null && count > 0;
    }

    public boolean columnExists(String table, String column) {
        Integer count = StoreErrorTranslator.execute("columnExists " + table, () -> jdbcTemplate.queryForObject("""
                SELECT COUNT(*)
                FROM information_schema.columns
                WHERE LOWER(table_name) = LOWER(?)
                  AND LOWER(column_name) = LOWER(?)
                  AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)
                """, Integer.class, table, column));
        return count != null && count > 0;
    }

    public boolean constraintExists(String table, String constraint) {
        Integer count = StoreErrorTranslator.execute("constraintExists " + constraint, () -> jdbcTemplate.queryForObject("""
                SELECT COUNT(*)
                FROM information_schema.table_constraints
                WHERE LOWER(table_name) = LOWER(?)
                  AND LOWER(constraint_name) = LOWER(?)
                  AND LOWER(constraint_schema) = LOWER(CURRENT_SCHEMA)
                """, Integer.class, table, constraint));
        return count != null && count > 0;
    }

    /**
     * The pre-migration flat table used the live listings name but keyed rows by
     * a per-crawl {@code record_id}. While it is there, the live schema cannot be created.
     */
    public boolean isLegacyFlatTable(String table) {
        return tableExists(table) && columnExists(table, "record_id");
    }
}
