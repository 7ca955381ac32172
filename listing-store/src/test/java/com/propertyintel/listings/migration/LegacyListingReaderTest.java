package com.propertyintel.listings.migration;

import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.support.H2StoreTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LegacyListingReaderTest extends H2StoreTestBase {

    private static final LegacyTables BUY = LegacyTables.of(Category.BUY);

    private LegacyListingReader reader;

    @BeforeEach
    void setUpLegacyData() {
        new ResourceDatabasePopulator(new ClassPathResource("legacy/buy-legacy-schema.sql")).execute(dataSource);

        // inserted out of order on purpose
        legacyRow(1, 3003, "2024-01-05T08:00:00Z", "Beschikbaar");
        legacyRow(2, 1001, "2024-01-08T08:00:00Z", "Beschikbaar");
        legacyRow(3, 2002, "2024-01-02T08:00:00Z", "Beschikbaar");
        legacyRow(4, 1001, "2024-01-01T08:00:00Z", "Beschikbaar");
        legacyRow(5, 3003, "2024-01-04T08:00:00Z", "Beschikbaar");
        legacyRow(6, 1001, "2024-01-15T08:00:00Z", "Verkocht");
        jdbcTemplate.update("""
                INSERT INTO buy_details (listing_record_id, deposit, description)
                VALUES (4, 3000, 'Canal house')
                """);

        reader = new LegacyListingReader(jdbcTemplate, schemaManager, properties);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 500})
    void readsEveryRowGroupedByPropertyInCrawlOrder(int pageSize) {
        properties.getMigration().setReadPageSize(pageSize);
        List<String> seen = new ArrayList<>();

        long rows = reader.stream(BUY, row -> seen.add(row.propertyId() + "/" + row.recordId()));

        assertThat(rows).isEqualTo(6);
        assertThat(seen).containsExactly("1001/4", "1001/2", "1001/6", "2002/3", "3003/5", "3003/1");
    }

    @Test
    void pageBoundaryNeverSplitsAProperty() {
        properties.getMigration().setReadPageSize(1);
        List<Long> propertyOrder = new ArrayList<>();

        reader.stream(BUY, row -> {
            if (propertyOrder.isEmpty() || propertyOrder.get(propertyOrder.size() - 1) != row.propertyId()) {
                propertyOrder.add(row.propertyId());
            }
        });

        assertThat(propertyOrder).containsExactly(1001L, 2002L, 3003L);
    }

    @Test
    void joinsDetailsIntoVolatileFields() {
        List<LegacyRow> rows = new ArrayList<>();

        reader.stream(BUY, rows::add);

        LegacyRow first = rows.get(0);
        assertThat(first.recordId()).isEqualTo(4);
        assertThat(first.fields().getDetails()).containsEntry("description", "Canal house");
        assertThat(first.fields().getPrice()).isEqualByComparingTo("450000");
    }

    @Test
    void readsWithoutDetailsTable() {
        jdbcTemplate.execute("DROP TABLE buy_details");
        List<LegacyRow> rows = new ArrayList<>();

        long count = reader.stream(BUY, rows::add);

        assertThat(count).isEqualTo(6);
        assertThat(rows).allSatisfy(row -> assertThat(row.fields().getDetails()).isEmpty());
    }

    @Test
    void emptyLegacyTableReadsNothing() {
        jdbcTemplate.execute("DELETE FROM buy_details");
        jdbcTemplate.execute("DELETE FROM buy_listings");

        assertThat(reader.stream(BUY, row -> {
        })).isZero();
    }

    private void legacyRow(long recordId, long propertyId, String createdAt, String status) {
        jdbcTemplate.update("""
                INSERT INTO buy_listings
                (record_id, property_id, created_at, property_type, status, asking_price, floor_area,
                 number_of_rooms, energy_label, address_country, address_city, address_street, address_number)
                VALUES (?, ?, ?, 'house', ?, ?, 120, 5, 'B', 'NL', 'Amsterdam', 'Keizersgracht', '1')
                """,
                recordId, propertyId, Timestamp.from(Instant.parse(createdAt)), status, new BigDecimal("450000"));
    }
}
