package com.propertyintel.listings.store;

import com.propertyintel.listings.model.IdentityFields;
import com.propertyintel.listings.model.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One row per physical listing plus the pointer to its current snapshot.
 *
 * All writes are single statements guarded by timestamp comparisons, so concurrent
 * writers and replays converge to the same row whatever order they arrive in.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ListingDimension {

    private static final String INSERT_COLUMNS = """
            (listing_id, address_country, address_province, address_city, address_municipality,
             address_district, address_neighbourhood, address_street, address_number, address_suffix,
             address_postal_code, address_is_bag, latitude, longitude, property_type, construction_year,
             first_seen_at, last_seen_at)
            VALUES
            (:listingId, :country, :province, :city, :municipality,
             :district, :neighbourhood, :street, :houseNumber, :suffix,
             :postalCode, :bag, :latitude, :longitude, :propertyType, :constructionYear,
             :firstSeenAt, :lastSeenAt)
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final DatabaseDialect dialect;

    /**
     * Creates the listing on first sight; afterwards widens the seen window and
     * applies identity fields when this observation is the newest one so far.
     *
     * <p>Two observations with the same timestamp but different identity fields
     * are not ordered: the one applied last wins, so under reordering the stored
     * identity can differ. Crawler timestamps carry millisecond precision, which
     * makes this rare in practice.
     */
    public Listing upsertListing(TableSet tables, long listingId, IdentityFields identity, Instant observedAt) {
        String operation = "upsertListing " + tables.listings() + "/" + listingId;
        MapSqlParameterSource params = identityParams(listingId, identity, observedAt, observedAt)
                .addValue("observedAt", Timestamp.from(observedAt));

        StoreErrorTranslator.run(operation, () -> {
            if (insertIfAbsent(tables, params)) {
                log.debug("Created listing {} in {}", listingId, tables.listings());
                return;
            }

            // last-write-wins by observation time; equal times fall back to arrival order
            jdbc.update("""
                    UPDATE %s
                    SET address_country = :country,
                        address_province = :province,
                        address_city = :city,
                        address_municipality = :municipality,
                        address_district = :district,
                        address_neighbourhood = :neighbourhood,
                        address_street = :street,
                        address_number = :houseNumber,
                        address_suffix = :suffix,
                        address_postal_code = :postalCode,
                        address_is_bag = :bag,
                        latitude = :latitude,
                        longitude = :longitude,
                        property_type = :propertyType,
                        construction_year = :constructionYear,
                        last_seen_at = :observedAt
                    WHERE listing_id = :listingId
                      AND last_seen_at <= :observedAt
                    """.formatted(tables.listings()), params);

            jdbc.update("""
                    UPDATE %s
                    SET first_seen_at = :observedAt
                    WHERE listing_id = :listingId
                      AND first_seen_at > :observedAt
                    """.formatted(tables.listings()), params);
        });

        return findListing(tables, listingId)
                .orElseThrow(() -> new StorageUnavailableException(operation + ": listing disappeared after upsert", null));
    }

    /**
     * Backfill variant: creates the listing with an explicit seen window and
     * leaves an existing row untouched.
     *
     * @return true if the row was created
     */
    public boolean insertListingIfAbsent(TableSet tables, long listingId, IdentityFields identity,
                                         Instant firstSeenAt, Instant lastSeenAt) {
        MapSqlParameterSource params = identityParams(listingId, identity, firstSeenAt, lastSeenAt);
        return StoreErrorTranslator.execute("insertListingIfAbsent " + tables.listings() + "/" + listingId,
                () -> insertIfAbsent(tables, params));
    }

    /**
     * Extends last_seen_at without touching identity fields.
     */
    public void extendLastSeen(TableSet tables, long listingId, Instant seenAt) {
        StoreErrorTranslator.run("extendLastSeen " + listingId, () -> jdbc.update("""
                UPDATE %s
                SET last_seen_at = :seenAt
                WHERE listing_id = :listingId
                  AND last_seen_at < :seenAt
                """.formatted(tables.listings()),
                new MapSqlParameterSource()
                        .addValue("listingId", listingId)
                        .addValue("seenAt", Timestamp.from(seenAt))));
    }

    /**
     * Points the listing at its latest snapshot, read fresh inside the statement.
     * Idempotent and safe to call redundantly or concurrently.
     */
    public void refreshCurrentPointer(TableSet tables, long listingId) {
        StoreErrorTranslator.run("refreshCurrentPointer " + tables.listings() + "/" + listingId, () -> jdbc.update("""
                UPDATE %s
                SET current_snapshot_id = (
                    SELECT s.snapshot_id
                    FROM %s s
                    WHERE s.listing_id = :listingId
                    ORDER BY s.snapshot_ts DESC, s.snapshot_id DESC
                    LIMIT 1
                )
                WHERE listing_id = :listingId
                """.formatted(tables.listings(), tables.snapshots()),
                new MapSqlParameterSource("listingId", listingId)));
    }

    public Optional<Listing> findListing(TableSet tables, long listingId) {
        List<Listing> rows = StoreErrorTranslator.execute("findListing " + listingId, () -> jdbc.query(
                "SELECT * FROM %s WHERE listing_id = :listingId".formatted(tables.listings()),
                new MapSqlParameterSource("listingId", listingId),
                listingMapper(tables)));
        return rows.stream().findFirst();
    }

    public List<Listing> findAll(TableSet tables) {
        return StoreErrorTranslator.execute("findAllListings " + tables.listings(), () -> jdbc.query(
                "SELECT * FROM %s ORDER BY listing_id".formatted(tables.listings()),
                listingMapper(tables)));
    }

    public long countListings(TableSet tables) {
        Long count = StoreErrorTranslator.execute("countListings " + tables.listings(), () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + tables.listings(), new MapSqlParameterSource(), Long.class));
        return count == null ? 0 : count;
    }

    public long countWithoutCurrentSnapshot(TableSet tables) {
        Long count = StoreErrorTranslator.execute("countWithoutCurrentSnapshot", () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM %s WHERE current_snapshot_id IS NULL".formatted(tables.listings()),
                new MapSqlParameterSource(), Long.class));
        return count == null ? 0 : count;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean insertIfAbsent(TableSet tables, MapSqlParameterSource params) {
        String insert = "INSERT INTO " + tables.listings() + "\n" + INSERT_COLUMNS;
        if (dialect.isPostgres()) {
            return jdbc.update(insert + " ON CONFLICT (listing_id) DO NOTHING", params) > 0;
        }
        try {
            jdbc.update(insert, params);
            return true;
        } catch (DuplicateKeyException ignored) {
            return false;
        }
    }

    private MapSqlParameterSource identityParams(long listingId, IdentityFields identity,
                                                 Instant firstSeenAt, Instant lastSeenAt) {
        IdentityFields id = identity != null ? identity : new IdentityFields();
        return new MapSqlParameterSource()
                .addValue("listingId", listingId)
                .addValue("country", id.getCountry())
                .addValue("province", id.getProvince())
                .addValue("city", id.getCity())
                .addValue("municipality", id.getMunicipality())
                .addValue("district", id.getDistrict())
                .addValue("neighbourhood", id.getNeighbourhood())
                .addValue("street", id.getStreet())
                .addValue("houseNumber", id.getHouseNumber())
                .addValue("suffix", id.getHouseNumberSuffix())
                .addValue("postalCode", id.getPostalCode())
                .addValue("bag", id.getBagAddress())
                .addValue("latitude", id.getLatitude())
                .addValue("longitude", id.getLongitude())
                .addValue("propertyType", id.getPropertyType())
                .addValue("constructionYear", id.getConstructionYear())
                .addValue("firstSeenAt", Timestamp.from(firstSeenAt))
                .addValue("lastSeenAt", Timestamp.from(lastSeenAt));
    }

    private RowMapper<Listing> listingMapper(TableSet tables) {
        return (rs, rowNum) -> Listing.builder()
                .listingId(rs.getLong("listing_id"))
                .category(tables.category())
                .identity(IdentityFields.builder()
                        .country(rs.getString("address_country"))
                        .province(rs.getString("address_province"))
                        .city(rs.getString("address_city"))
                        .municipality(rs.getString("address_municipality"))
                        .district(rs.getString("address_district"))
                        .neighbourhood(rs.getString("address_neighbourhood"))
                        .street(rs.getString("address_street"))
                        .houseNumber(rs.getString("address_number"))
                        .houseNumberSuffix(rs.getString("address_suffix"))
                        .postalCode(rs.getString("address_postal_code"))
                        .bagAddress(JdbcValues.booleanOrNull(rs, "address_is_bag"))
                        .latitude(rs.getBigDecimal("latitude"))
                        .longitude(rs.getBigDecimal("longitude"))
                        .propertyType(rs.getString("property_type"))
                        .constructionYear(JdbcValues.integerOrNull(rs, "construction_year"))
                        .build())
                .firstSeenAt(JdbcValues.instantOrNull(rs, "first_seen_at"))
                .lastSeenAt(JdbcValues.instantOrNull(rs, "last_seen_at"))
                .currentSnapshotId(JdbcValues.longOrNull(rs, "current_snapshot_id"))
                .build();
    }
}
