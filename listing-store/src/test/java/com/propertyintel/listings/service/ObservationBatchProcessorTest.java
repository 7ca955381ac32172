package com.propertyintel.listings.service;

import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.model.IngestionBatchResult;
import com.propertyintel.listings.model.IngestionOutcome;
import com.propertyintel.listings.model.RawObservation;
import com.propertyintel.listings.store.ConstraintViolationException;
import com.propertyintel.listings.store.InvalidStoreOperationException;
import com.propertyintel.listings.store.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObservationBatchProcessorTest {

    @Mock
    private ListingIngestionService ingestionService;

    private ObservationBatchProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ObservationBatchProcessor(ingestionService);
    }

    private static RawObservation observation(long id) {
        return RawObservation.builder()
                .listingId(id)
                .category(Category.BUY)
                .observedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    private static IngestionOutcome outcome(long id, boolean newSnapshot, boolean active) {
        return IngestionOutcome.builder()
                .listingId(id)
                .category(Category.BUY)
                .newSnapshot(newSnapshot)
                .active(active)
                .build();
    }

    @Test
    void countsOutcomes() {
        // Given
        RawObservation first = observation(1);
        RawObservation second = observation(2);
        RawObservation third = observation(3);
        when(ingestionService.ingest(first)).thenReturn(outcome(1, true, true));
        when(ingestionService.ingest(second)).thenReturn(outcome(2, false, true));
        when(ingestionService.ingest(third)).thenReturn(outcome(3, true, false));

        // When
        IngestionBatchResult result = processor.process(List.of(first, second, third));

        // Then
        assertThat(result.getReceived()).isEqualTo(3);
        assertThat(result.getNewSnapshots()).isEqualTo(2);
        assertThat(result.getDuplicates()).isEqualTo(1);
        assertThat(result.getRetired()).isEqualTo(1);
        assertThat(result.getFailed()).isZero();
    }

    @Test
    void storageOutageIsCountedAndBatchContinues() {
        // Given
        RawObservation failing = observation(1);
        RawObservation next = observation(2);
        when(ingestionService.ingest(failing)).thenThrow(new StorageUnavailableException("db down", null));
        when(ingestionService.ingest(next)).thenReturn(outcome(2, true, true));

        // When
        IngestionBatchResult result = processor.process(List.of(failing, next));

        // Then
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getNewSnapshots()).isEqualTo(1);
        assertThat(result.getFailures()).singleElement().asString().startsWith("BUY/1: ").contains("db down");
    }

    @Test
    void constraintViolationStopsTheBatch() {
        // Given
        RawObservation broken = observation(1);
        RawObservation skipped = observation(2);
        when(ingestionService.ingest(broken)).thenThrow(new ConstraintViolationException("fk", null));

        // When / Then
        assertThatThrownBy(() -> processor.process(List.of(broken, skipped)))
                .isInstanceOf(ConstraintViolationException.class);
        verify(ingestionService, never()).ingest(skipped);
    }

    @Test
    void rejectedStatementStopsTheBatch() {
        RawObservation broken = observation(1);
        RawObservation skipped = observation(2);
        when(ingestionService.ingest(broken))
                .thenThrow(new InvalidStoreOperationException("upsertListing buy_listings/1 rejected", null));

        assertThatThrownBy(() -> processor.process(List.of(broken, skipped)))
                .isInstanceOf(InvalidStoreOperationException.class);
        verify(ingestionService, never()).ingest(skipped);
    }

    @Test
    void emptyBatchDoesNothing() {
        assertThat(processor.process(List.of()).getReceived()).isZero();
        assertThat(processor.process(null).getReceived()).isZero();
        verifyNoInteractions(ingestionService);
    }
}
