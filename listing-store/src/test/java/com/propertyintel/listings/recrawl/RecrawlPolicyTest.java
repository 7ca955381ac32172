package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.Category;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RecrawlPolicyTest {

    private static final Instant OBSERVED = Instant.parse("2024-05-10T12:00:00Z");

    private final ListingStoreProperties.Recrawl settings = new ListingStoreProperties.Recrawl();

    @Nested
    @DisplayName("Fixed interval")
    class Fixed {

        private final RecrawlPolicy policy = new FixedIntervalRecrawlPolicy(settings);

        @Test
        void usesCategoryInterval() {
            assertThat(policy.nextEligibleAt(Category.RENT, OBSERVED, null)).isEqualTo(OBSERVED.plus(Duration.ofDays(3)));
            assertThat(policy.nextEligibleAt(Category.BUY, OBSERVED, null)).isEqualTo(OBSERVED.plus(Duration.ofDays(7)));
        }

        @Test
        void ignoresStability() {
            Instant stableSince = OBSERVED.minus(Duration.ofDays(60));

            assertThat(policy.nextEligibleAt(Category.RENT, OBSERVED, stableSince))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(3)));
        }

        @Test
        void honoursConfiguredInterval() {
            settings.setRentInterval(Duration.ofHours(12));

            assertThat(policy.nextEligibleAt(Category.RENT, OBSERVED, null)).isEqualTo(OBSERVED.plusSeconds(12 * 3600));
        }
    }

    @Nested
    @DisplayName("Volatility backoff")
    class Backoff {

        private final RecrawlPolicy policy = new VolatilityBackoffRecrawlPolicy(settings);

        @Test
        void justChangedUsesBaseInterval() {
            assertThat(policy.nextEligibleAt(Category.RENT, OBSERVED, OBSERVED))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(3)));
            assertThat(policy.nextEligibleAt(Category.RENT, OBSERVED, null))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(3)));
        }

        @Test
        void waitGrowsWithStability() {
            Instant stableSince = OBSERVED.minus(Duration.ofDays(10));

            assertThat(policy.nextEligibleAt(Category.RENT, OBSERVED, stableSince))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(10)));
        }

        @Test
        void waitIsCappedAtMax() {
            Instant stableSince = OBSERVED.minus(Duration.ofDays(90));

            assertThat(policy.nextEligibleAt(Category.BUY, OBSERVED, stableSince))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(30)));
        }

        @Test
        void stateNewerThanObservationCountsAsJustChanged() {
            Instant future = OBSERVED.plus(Duration.ofDays(1));

            assertThat(policy.nextEligibleAt(Category.BUY, OBSERVED, future))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(7)));
        }

        @Test
        void maxBelowBaseFallsBackToBase() {
            settings.setMaxInterval(Duration.ofDays(1));

            assertThat(policy.nextEligibleAt(Category.BUY, OBSERVED, OBSERVED.minus(Duration.ofDays(20))))
                    .isEqualTo(OBSERVED.plus(Duration.ofDays(7)));
        }
    }
}
