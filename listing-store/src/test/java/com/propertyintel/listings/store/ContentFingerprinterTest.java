package com.propertyintel.listings.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.model.VolatileFields;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContentFingerprinterTest {

    private final ContentFingerprinter fingerprinter = new ContentFingerprinter(new ObjectMapper());

    private static VolatileFields.VolatileFieldsBuilder base() {
        return VolatileFields.builder()
                .status("available")
                .price(new BigDecimal("1500"))
                .floorArea(new BigDecimal("65"))
                .numberOfRooms(3)
                .energyLabel("A");
    }

    @Test
    @DisplayName("Digest is 64 lowercase hex characters")
    void digestFormat() {
        assertThat(fingerprinter.fingerprint(base().build())).matches("[0-9a-f]{64}");
    }

    @Nested
    @DisplayName("Equivalent content")
    class Equivalent {

        @Test
        void surroundingWhitespaceIsIgnored() {
            VolatileFields padded = base().status("  available ").energyLabel("A ").build();

            assertThat(fingerprinter.fingerprint(padded)).isEqualTo(fingerprinter.fingerprint(base().build()));
        }

        @Test
        void numericScaleIsIgnored() {
            VolatileFields scaled = base().price(new BigDecimal("1500.00")).floorArea(new BigDecimal("65.0")).build();

            assertThat(fingerprinter.fingerprint(scaled)).isEqualTo(fingerprinter.fingerprint(base().build()));
        }

        @Test
        void blankStringEqualsNull() {
            VolatileFields blank = base().energyLabel("   ").build();
            VolatileFields missing = base().energyLabel(null).build();

            assertThat(fingerprinter.fingerprint(blank)).isEqualTo(fingerprinter.fingerprint(missing));
        }

        @Test
        void detailKeyOrderIsIgnored() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("deposit", 3000);
            first.put("description", "Bright flat");
            first.put("heating", Map.of("type", "central", "year", 2015));

            Map<String, Object> second = new LinkedHashMap<>();
            second.put("heating", Map.of("year", 2015, "type", "central"));
            second.put("description", "Bright flat");
            second.put("deposit", new BigDecimal("3000.00"));

            assertThat(fingerprinter.fingerprint(base().details(first).build()))
                    .isEqualTo(fingerprinter.fingerprint(base().details(second).build()));
        }

        @Test
        void nullDetailEntriesAreDropped() {
            Map<String, Object> withNull = new LinkedHashMap<>();
            withNull.put("deposit", 3000);
            withNull.put("volume", null);

            assertThat(fingerprinter.fingerprint(base().details(withNull).build()))
                    .isEqualTo(fingerprinter.fingerprint(base().details(Map.of("deposit", 3000)).build()));
        }
    }

    @Nested
    @DisplayName("Changed content")
    class Changed {

        @Test
        void priceChangeChangesDigest() {
            VolatileFields cheaper = base().price(new BigDecimal("1450")).build();

            assertThat(fingerprinter.fingerprint(cheaper)).isNotEqualTo(fingerprinter.fingerprint(base().build()));
        }

        @Test
        void statusCaseIsSignificant() {
            VolatileFields upper = base().status("Available").build();

            assertThat(fingerprinter.fingerprint(upper)).isNotEqualTo(fingerprinter.fingerprint(base().build()));
        }

        @Test
        void valueMovedBetweenFieldsChangesDigest() {
            VolatileFields rooms = base().numberOfRooms(3).numberOfBedrooms(null).build();
            VolatileFields bedrooms = base().numberOfRooms(null).numberOfBedrooms(3).build();

            assertThat(fingerprinter.fingerprint(rooms)).isNotEqualTo(fingerprinter.fingerprint(bedrooms));
        }

        @Test
        void detailListOrderIsSignificant() {
            VolatileFields ab = base().details(Map.of("features", List.of("balcony", "garden"))).build();
            VolatileFields ba = base().details(Map.of("features", List.of("garden", "balcony"))).build();

            assertThat(fingerprinter.fingerprint(ab)).isNotEqualTo(fingerprinter.fingerprint(ba));
        }
    }

    @Nested
    @DisplayName("Canonical details JSON")
    class DetailsJson {

        @Test
        void keysSortedAndNumbersPlain() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("volume", new BigDecimal("1.5E+2"));
            details.put("deposit", new BigDecimal("3000.00"));

            assertThat(fingerprinter.canonicalDetailsJson(details)).isEqualTo("{\"deposit\":3000,\"volume\":150}");
        }

        @Test
        void emptyPayloadIsNull() {
            Map<String, Object> onlyNulls = new LinkedHashMap<>();
            onlyNulls.put("deposit", null);

            assertThat(fingerprinter.canonicalDetailsJson(Map.of())).isNull();
            assertThat(fingerprinter.canonicalDetailsJson(null)).isNull();
            assertThat(fingerprinter.canonicalDetailsJson(onlyNulls)).isNull();
        }
    }
}
