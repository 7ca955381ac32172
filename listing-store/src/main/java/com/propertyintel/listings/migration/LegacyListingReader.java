package com.propertyintel.listings.migration;

import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.IdentityFields;
import com.propertyintel.listings.model.VolatileFields;
import com.propertyintel.listings.store.JdbcValues;
import com.propertyintel.listings.store.SchemaManager;
import com.propertyintel.listings.store.StoreErrorTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads the legacy tables in pages of whole properties, keyed on property_id and
 * ordered by crawl time within a property, so a backfill holds at most one page
 * of properties in memory whatever the driver does with fetch sizes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LegacyListingReader {

    private final JdbcTemplate jdbcTemplate;
    private final SchemaManager schemaManager;
    private final ListingStoreProperties properties;

    /**
     * Calls {@code sink} for every legacy row, ordered by (property_id, created_at, record_id).
     *
     * @return number of rows read
     */
    public long stream(LegacyTables legacy, Consumer<LegacyRow> sink) {
        boolean withDetails = schemaManager.tableExists(legacy.details());
        if (!withDetails) {
            log.warn("Legacy details table {} not found, migrating {} without details",
                    legacy.details(), legacy.listings());
        }

        String page = """
                SELECT DISTINCT property_id FROM %s
                WHERE property_id > ?
                ORDER BY property_id
                LIMIT ?
                """.formatted(legacy.listings());
        String sql = withDetails
                ? """
                  SELECT l.*, d.construction_year AS d_construction_year, d.deposit AS d_deposit,
                         d.living_area AS d_living_area, d.volume AS d_volume, d.house_type AS d_house_type,
                         d.description AS d_description, d.listed_since AS d_listed_since
                  FROM (%s) p
                  JOIN %s l ON l.property_id = p.property_id
                  LEFT JOIN %s d ON d.listing_record_id = l.record_id
                  ORDER BY l.property_id, l.created_at, l.record_id
                  """.formatted(page, legacy.listings(), legacy.details())
                : """
                  SELECT l.*
                  FROM (%s) p
                  JOIN %s l ON l.property_id = p.property_id
                  ORDER BY l.property_id, l.created_at, l.record_id
                  """.formatted(page, legacy.listings());

        int pageSize = Math.max(1, properties.getMigration().getReadPageSize());
        long[] rows = {0};
        long[] lastPropertyId = {Long.MIN_VALUE};
        int pages = 0;
        while (true) {
            long pageStart = rows[0];
            long after = lastPropertyId[0];
            StoreErrorTranslator.run("readLegacy " + legacy.listings() + " after " + after, () ->
                    jdbcTemplate.query(sql, (RowCallbackHandler) rs -> {
                        LegacyRow row = mapRow(rs, legacy, withDetails);
                        lastPropertyId[0] = row.propertyId();
                        sink.accept(row);
                        rows[0]++;
                    }, after, pageSize));
            if (rows[0] == pageStart) {
                break;
            }
            pages++;
            log.debug("Read legacy page {} of {} ({} rows so far)", pages, legacy.listings(), rows[0]);
        }
        return rows[0];
    }

    public long countRows(LegacyTables legacy) {
        Long count = StoreErrorTranslator.execute("countLegacyRows " + legacy.listings(), () ->
                jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + legacy.listings(), Long.class));
        return count == null ? 0 : count;
    }

    /**
     * Distinct properties a backfill can migrate; rows without a crawl time are skipped.
     */
    public long countDistinctListings(LegacyTables legacy) {
        Long count = StoreErrorTranslator.execute("countLegacyListings " + legacy.listings(), () ->
                jdbcTemplate.queryForObject(
                        "SELECT COUNT(DISTINCT property_id) FROM %s WHERE created_at IS NOT NULL"
                                .formatted(legacy.listings()), Long.class));
        return count == null ? 0 : count;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private LegacyRow mapRow(ResultSet rs, LegacyTables legacy, boolean withDetails) throws SQLException {
        Integer constructionYear = withDetails ? JdbcValues.integerOrNull(rs, "d_construction_year") : null;

        IdentityFields identity = IdentityFields.builder()
                .country(rs.getString("address_country"))
                .province(rs.getString("address_province"))
                .city(rs.getString("address_city"))
                .street(rs.getString("address_street"))
                .houseNumber(rs.getString("address_number"))
                .houseNumberSuffix(rs.getString("address_suffix"))
                .postalCode(rs.getString("address_postal_code"))
                .propertyType(rs.getString("property_type"))
                .constructionYear(constructionYear)
                .build();

        Map<String, Object> details = new LinkedHashMap<>();
        if (withDetails) {
            details.put("construction_year", constructionYear);
            details.put("deposit", rs.getBigDecimal("d_deposit"));
            details.put("living_area", rs.getBigDecimal("d_living_area"));
            details.put("volume", rs.getBigDecimal("d_volume"));
            details.put("house_type", rs.getString("d_house_type"));
            details.put("description", rs.getString("d_description"));
            details.put("listed_since", rs.getString("d_listed_since"));
        }

        VolatileFields fields = VolatileFields.builder()
                .status(rs.getString("status"))
                .price(rs.getBigDecimal(legacy.priceColumn()))
                .floorArea(rs.getBigDecimal("floor_area"))
                .plotArea(rs.getBigDecimal("plot_area"))
                .numberOfRooms(JdbcValues.integerOrNull(rs, "number_of_rooms"))
                .energyLabel(rs.getString("energy_label"))
                .details(details)
                .build();

        return new LegacyRow(
                rs.getLong("record_id"),
                rs.getLong("property_id"),
                JdbcValues.instantOrNull(rs, "created_at"),
                identity,
                fields);
    }
}
