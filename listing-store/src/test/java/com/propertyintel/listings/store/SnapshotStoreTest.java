package com.propertyintel.listings.store;

import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.model.SnapshotRecordResult;
import com.propertyintel.listings.model.VolatileFields;
import com.propertyintel.listings.support.H2StoreTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotStoreTest extends H2StoreTestBase {

    @Test
    @DisplayName("Recording the same content twice keeps one snapshot and the first timestamp")
    void recordIsIdempotent() {
        createListing(RENT, 42, at("2024-05-01T10:00:00Z"));

        SnapshotRecordResult first = snapshotStore.recordObservation(
                RENT, 42, at("2024-05-01T10:00:00Z"), fields("available", "1500"));
        SnapshotRecordResult again = snapshotStore.recordObservation(
                RENT, 42, at("2024-05-01T10:05:00Z"), fields("available", "1500.00"));

        assertThat(first.isNew()).isTrue();
        assertThat(again.isNew()).isFalse();
        assertThat(again.snapshotId()).isEqualTo(first.snapshotId());
        assertThat(again.fingerprint()).isEqualTo(first.fingerprint());
        assertThat(snapshotStore.countSnapshots(RENT)).isEqualTo(1);
        assertThat(snapshotStore.findById(RENT, first.snapshotId()))
                .get()
                .extracting(Snapshot::getSnapshotTs)
                .isEqualTo(at("2024-05-01T10:00:00Z"));
    }

    @Test
    void differentContentCreatesNewSnapshot() {
        createListing(RENT, 42, at("2024-05-01T10:00:00Z"));

        SnapshotRecordResult a = snapshotStore.recordObservation(RENT, 42, at("2024-05-01T10:00:00Z"), fields("available", "1500"));
        SnapshotRecordResult b = snapshotStore.recordObservation(RENT, 42, at("2024-05-01T10:10:00Z"), fields("available", "1450"));

        assertThat(b.isNew()).isTrue();
        assertThat(b.snapshotId()).isNotEqualTo(a.snapshotId());
        assertThat(snapshotStore.history(RENT, 42))
                .extracting(s -> s.getFields().getPrice())
                .containsExactly(new BigDecimal("1500.00"), new BigDecimal("1450.00"));
    }

    @Test
    void sameContentOnDifferentListingsIsNotDeduplicated() {
        createListing(RENT, 1, at("2024-05-01T10:00:00Z"));
        createListing(RENT, 2, at("2024-05-01T10:00:00Z"));

        snapshotStore.recordObservation(RENT, 1, at("2024-05-01T10:00:00Z"), fields("available", "1500"));
        SnapshotRecordResult other = snapshotStore.recordObservation(RENT, 2, at("2024-05-01T10:00:00Z"), fields("available", "1500"));

        assertThat(other.isNew()).isTrue();
        assertThat(snapshotStore.countSnapshots(RENT)).isEqualTo(2);
    }

    @Test
    @DisplayName("Snapshot for an unknown listing is a constraint violation")
    void unknownListingIsRejected() {
        assertThatThrownBy(() -> snapshotStore.recordObservation(
                RENT, 999, at("2024-05-01T10:00:00Z"), fields("available", "1500")))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("999");
        assertThat(snapshotStore.countSnapshots(RENT)).isZero();
    }

    @Test
    @DisplayName("Latest snapshot ties on timestamp go to the later insert")
    void latestSnapshotTieBreak() {
        createListing(RENT, 42, at("2024-05-01T10:00:00Z"));
        snapshotStore.recordObservation(RENT, 42, at("2024-05-01T10:00:00Z"), fields("available", "1500"));
        SnapshotRecordResult later = snapshotStore.recordObservation(
                RENT, 42, at("2024-05-01T10:00:00Z"), fields("under option", "1500"));

        assertThat(snapshotStore.latestSnapshot(RENT, 42))
                .get()
                .extracting(Snapshot::getSnapshotId)
                .isEqualTo(later.snapshotId());
    }

    @Test
    void latestSnapshotOrdersByTimestampNotInsertion() {
        createListing(RENT, 42, at("2024-05-01T10:00:00Z"));
        SnapshotRecordResult newest = snapshotStore.recordObservation(
                RENT, 42, at("2024-05-03T10:00:00Z"), fields("available", "1400"));
        snapshotStore.recordObservation(RENT, 42, at("2024-05-01T10:00:00Z"), fields("available", "1500"));

        assertThat(snapshotStore.latestSnapshot(RENT, 42).map(Snapshot::getSnapshotId)).contains(newest.snapshotId());
        assertThat(snapshotStore.latestSnapshot(RENT, 7)).isEmpty();
    }

    @Test
    void detailsAreStoredAsCanonicalJson() {
        createListing(RENT, 42, at("2024-05-01T10:00:00Z"));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("description", "Bright flat");
        details.put("deposit", 3000);
        details.put("volume", null);
        VolatileFields withDetails = fields("available", "1500");
        withDetails.setDetails(details);

        SnapshotRecordResult recorded = snapshotStore.recordObservation(RENT, 42, at("2024-05-01T10:00:00Z"), withDetails);

        String stored = jdbcTemplate.queryForObject(
                "SELECT details_json FROM rent_listing_snapshots WHERE snapshot_id = ?", String.class, recorded.snapshotId());
        assertThat(stored).isEqualTo("{\"deposit\":3000,\"description\":\"Bright flat\"}");

        List<Snapshot> history = snapshotStore.history(RENT, 42);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getFields().getDetails())
                .containsEntry("description", "Bright flat")
                .containsKey("deposit")
                .doesNotContainKey("volume");
    }
}
