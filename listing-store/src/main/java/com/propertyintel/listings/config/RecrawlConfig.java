package com.propertyintel.listings.config;

import com.propertyintel.listings.recrawl.FixedIntervalRecrawlPolicy;
import com.propertyintel.listings.recrawl.ListingStatusClassifier;
import com.propertyintel.listings.recrawl.RecrawlPolicy;
import com.propertyintel.listings.recrawl.VolatilityBackoffRecrawlPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RecrawlConfig {

    @Bean
    public RecrawlPolicy recrawlPolicy(ListingStoreProperties properties) {
        ListingStoreProperties.Recrawl recrawl = properties.getRecrawl();
        log.info("Recrawl policy {} (rent every {}, buy every {}, max {})",
                recrawl.getPolicy(), recrawl.getRentInterval(), recrawl.getBuyInterval(), recrawl.getMaxInterval());

        return switch (recrawl.getPolicy()) {
            case FIXED -> new FixedIntervalRecrawlPolicy(recrawl);
            case BACKOFF -> new VolatilityBackoffRecrawlPolicy(recrawl);
        };
    }

    @Bean
    public ListingStatusClassifier listingStatusClassifier(ListingStoreProperties properties) {
        return ListingStatusClassifier.from(properties);
    }
}
