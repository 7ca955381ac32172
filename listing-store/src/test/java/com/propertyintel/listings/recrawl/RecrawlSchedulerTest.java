package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.model.RecrawlEntry;
import com.propertyintel.listings.support.H2StoreTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecrawlSchedulerTest extends H2StoreTestBase {

    @Nested
    @DisplayName("markActive / markInactive")
    class Marking {

        @Test
        void missingListingIsNotScheduled() {
            boolean scheduled = recrawlScheduler.markActive(RENT, 404, at("2024-05-04T10:00:00Z"));

            assertThat(scheduled).isFalse();
            assertThat(recrawlScheduler.countActive(RENT)).isZero();
        }

        @Test
        void markActiveInsertsThenMoves() {
            createListing(RENT, 42, at("2024-05-01T10:00:00Z"));

            assertThat(recrawlScheduler.markActive(RENT, 42, at("2024-05-04T10:00:00Z"))).isTrue();
            assertThat(recrawlScheduler.markActive(RENT, 42, at("2024-05-06T10:00:00Z"))).isTrue();

            assertThat(recrawlScheduler.findEntry(RENT, 42))
                    .contains(new RecrawlEntry(42, at("2024-05-06T10:00:00Z")));
            assertThat(recrawlScheduler.countActive(RENT)).isEqualTo(1);
        }

        @Test
        void markInactiveIsIdempotent() {
            createListing(RENT, 42, at("2024-05-01T10:00:00Z"));
            recrawlScheduler.markActive(RENT, 42, at("2024-05-04T10:00:00Z"));

            assertThat(recrawlScheduler.markInactive(RENT, 42)).isTrue();
            assertThat(recrawlScheduler.markInactive(RENT, 42)).isFalse();
            assertThat(recrawlScheduler.findEntry(RENT, 42)).isEmpty();
        }
    }

    @Nested
    @DisplayName("dueForRecrawl")
    class Due {

        @BeforeEach
        void queue() {
            // 5 and 3 share a timestamp: ties go by listing id
            schedule(1, "2024-05-03T00:00:00Z");
            schedule(5, "2024-05-01T00:00:00Z");
            schedule(3, "2024-05-01T00:00:00Z");
            schedule(4, "2024-05-02T00:00:00Z");
            schedule(2, "2024-06-01T00:00:00Z");
        }

        @Test
        void returnsDueOldestFirst() {
            List<Long> due = recrawlScheduler.dueForRecrawl(RENT, at("2024-05-10T00:00:00Z"), 100).toList();

            assertThat(due).containsExactly(3L, 5L, 4L, 1L);
            assertThat(recrawlScheduler.countDue(RENT, at("2024-05-10T00:00:00Z"))).isEqualTo(4);
        }

        @Test
        void boundaryIsInclusive() {
            assertThat(recrawlScheduler.dueForRecrawl(RENT, at("2024-05-01T00:00:00Z"), 100).toList())
                    .containsExactly(3L, 5L);
        }

        @Test
        void limitCapsResult() {
            assertThat(recrawlScheduler.dueForRecrawl(RENT, at("2024-05-10T00:00:00Z"), 2).toList())
                    .containsExactly(3L, 5L);
            assertThat(recrawlScheduler.dueForRecrawl(RENT, at("2024-05-10T00:00:00Z"), 0).toList())
                    .isEmpty();
        }

        @Test
        void negativeLimitIsRejected() {
            assertThatThrownBy(() -> recrawlScheduler.dueForRecrawl(RENT, at("2024-05-10T00:00:00Z"), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void pagesAcrossSmallPageSize() {
            properties.getRecrawl().setPageSize(2);

            List<Long> due = recrawlScheduler.dueForRecrawl(RENT, at("2024-07-01T00:00:00Z"), 100).toList();

            assertThat(due).containsExactly(3L, 5L, 4L, 1L, 2L);
        }

        @Test
        @DisplayName("Each iteration re-reads the queue")
        void iterationIsRestartable() {
            DueListings due = recrawlScheduler.dueForRecrawl(RENT, at("2024-05-10T00:00:00Z"), 100);

            List<Long> first = new ArrayList<>();
            due.forEach(first::add);
            recrawlScheduler.markInactive(RENT, 3);
            List<Long> second = new ArrayList<>();
            due.forEach(second::add);

            assertThat(first).containsExactly(3L, 5L, 4L, 1L);
            assertThat(second).containsExactly(5L, 4L, 1L);
        }

        @Test
        void rescheduledEntriesAreNotReturnedTwice() {
            properties.getRecrawl().setPageSize(1);
            Iterator<Long> it = recrawlScheduler.dueForRecrawl(RENT, at("2024-05-10T00:00:00Z"), 100).iterator();

            List<Long> seen = new ArrayList<>();
            while (it.hasNext()) {
                long id = it.next();
                seen.add(id);
                // crawler handles it and pushes it out past asOf
                recrawlScheduler.markActive(RENT, id, at("2024-05-20T00:00:00Z"));
            }

            assertThat(seen).containsExactly(3L, 5L, 4L, 1L);
            assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
        }

        private void schedule(long listingId, String when) {
            createListing(RENT, listingId, at("2024-04-01T00:00:00Z"));
            recrawlScheduler.markActive(RENT, listingId, at(when));
        }
    }
}
