package com.propertyintel.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One scraped view of a listing, as handed over by the crawler.
 * The crawler owns HTML parsing; this is already structured.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawObservation {

    /** Source property id (Funda id), unique per category */
    private Long listingId;

    private Category category;

    /** When the crawler saw this state */
    private Instant observedAt;

    private IdentityFields identity;

    private VolatileFields volatileFields;
}
