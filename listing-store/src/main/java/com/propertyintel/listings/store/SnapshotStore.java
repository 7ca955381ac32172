package com.propertyintel.listings.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.model.SnapshotRecordResult;
import com.propertyintel.listings.model.VolatileFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only history of a listing's volatile fields, one row per distinct
 * fingerprint per listing.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class SnapshotStore {

    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final DatabaseDialect dialect;
    private final ContentFingerprinter fingerprinter;
    private final ObjectMapper objectMapper;

    /**
     * Insert-or-ignore keyed by (listing, fingerprint). Re-recording content that is
     * already stored returns the existing snapshot with {@code isNew == false}; its
     * timestamp is left untouched.
     *
     * @throws ConstraintViolationException if the listing row does not exist yet
     * @throws StorageUnavailableException  on persistence failure (safe to retry)
     */
    public SnapshotRecordResult recordObservation(TableSet tables, long listingId, Instant timestamp,
                                                  VolatileFields fields) {
        String fingerprint = fingerprinter.fingerprint(fields);

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("listingId", listingId)
                .addValue("snapshotTs", Timestamp.from(timestamp))
                .addValue("rowHash", fingerprint)
                .addValue("status", fields.getStatus())
                .addValue("price", fields.getPrice())
                .addValue("floorArea", fields.getFloorArea())
                .addValue("plotArea", fields.getPlotArea())
                .addValue("numberOfRooms", fields.getNumberOfRooms())
                .addValue("numberOfBedrooms", fields.getNumberOfBedrooms())
                .addValue("energyLabel", fields.getEnergyLabel())
                .addValue("details", fingerprinter.canonicalDetailsJson(fields.getDetails()));

        String operation = "recordObservation " + tables.snapshots() + "/" + listingId;
        boolean inserted = StoreErrorTranslator.execute(operation, () -> insertIgnoringDuplicate(tables, params));

        Long snapshotId = StoreErrorTranslator.execute(operation, () -> findSnapshotId(tables, listingId, fingerprint));
        if (snapshotId == null) {
            // Only possible if the listing was deleted between the two statements
            throw new StorageUnavailableException(operation + ": snapshot disappeared after insert", null);
        }

        if (inserted) {
            log.debug("New snapshot {} for listing {} ({})", snapshotId, listingId, tables.snapshots());
        } else {
            log.debug("Duplicate content for listing {} ignored, existing snapshot {}", listingId, snapshotId);
        }
        return new SnapshotRecordResult(snapshotId, inserted, fingerprint);
    }

    /**
     * Most recent snapshot by timestamp; ties go to the most recently inserted row.
     */
    public Optional<Snapshot> latestSnapshot(TableSet tables, long listingId) {
        List<Snapshot> rows = StoreErrorTranslator.execute("latestSnapshot " + listingId, () -> jdbc.query("""
                SELECT *
                FROM %s
                WHERE listing_id = :listingId
                ORDER BY snapshot_ts DESC, snapshot_id DESC
                LIMIT 1
                """.formatted(tables.snapshots()),
                new MapSqlParameterSource("listingId", listingId),
                snapshotMapper()));
        return rows.stream().findFirst();
    }

    public Optional<Snapshot> findById(TableSet tables, long snapshotId) {
        List<Snapshot> rows = StoreErrorTranslator.execute("findSnapshot " + snapshotId, () -> jdbc.query(
                "SELECT * FROM %s WHERE snapshot_id = :snapshotId".formatted(tables.snapshots()),
                new MapSqlParameterSource("snapshotId", snapshotId),
                snapshotMapper()));
        return rows.stream().findFirst();
    }

    /**
     * Full history, oldest first.
     */
    public List<Snapshot> history(TableSet tables, long listingId) {
        return StoreErrorTranslator.execute("history " + listingId, () -> jdbc.query("""
                SELECT *
                FROM %s
                WHERE listing_id = :listingId
                ORDER BY snapshot_ts ASC, snapshot_id ASC
                """.formatted(tables.snapshots()),
                new MapSqlParameterSource("listingId", listingId),
                snapshotMapper()));
    }

    public long countSnapshots(TableSet tables) {
        Long count = StoreErrorTranslator.execute("countSnapshots " + tables.snapshots(), () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + tables.snapshots(), new MapSqlParameterSource(), Long.class));
        return count == null ? 0 : count;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean insertIgnoringDuplicate(TableSet tables, MapSqlParameterSource params) {
        String insert = """
                INSERT INTO %s
                (listing_id, snapshot_ts, row_hash, status, price, floor_area, plot_area,
                 number_of_rooms, number_of_bedrooms, energy_label, details_json)
                VALUES
                (:listingId, :snapshotTs, :rowHash, :status, :price, :floorArea, :plotArea,
                 :numberOfRooms, :numberOfBedrooms, :energyLabel, %s)
                """.formatted(tables.snapshots(), dialect.jsonParam("details"));

        if (dialect.isPostgres()) {
            return jdbc.update(insert + " ON CONFLICT (listing_id, row_hash) DO NOTHING", params) > 0;
        }
        try {
            jdbc.update(insert, params);
            return true;
        } catch (DuplicateKeyException ignored) {
            return false;
        }
    }

    private Long findSnapshotId(TableSet tables, long listingId, String fingerprint) {
        List<Long> ids = jdbc.queryForList("""
                SELECT snapshot_id
                FROM %s
                WHERE listing_id = :listingId AND row_hash = :rowHash
                """.formatted(tables.snapshots()),
                new MapSqlParameterSource()
                        .addValue("listingId", listingId)
                        .addValue("rowHash", fingerprint),
                Long.class);
        return ids.isEmpty() ? null : ids.get(0);
    }

    private RowMapper<Snapshot> snapshotMapper() {
        return (rs, rowNum) -> Snapshot.builder()
                .snapshotId(rs.getLong("snapshot_id"))
                .listingId(rs.getLong("listing_id"))
                .snapshotTs(rs.getTimestamp("snapshot_ts").toInstant())
                .rowHash(rs.getString("row_hash"))
                .fields(VolatileFields.builder()
                        .status(rs.getString("status"))
                        .price(rs.getBigDecimal("price"))
                        .floorArea(rs.getBigDecimal("floor_area"))
                        .plotArea(rs.getBigDecimal("plot_area"))
                        .numberOfRooms(JdbcValues.integerOrNull(rs, "number_of_rooms"))
                        .numberOfBedrooms(JdbcValues.integerOrNull(rs, "number_of_bedrooms"))
                        .energyLabel(rs.getString("energy_label"))
                        .details(readDetails(rs.getString("details_json")))
                        .build())
                .build();
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (IOException e) {
            log.warn("Could not parse snapshot details JSON: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
