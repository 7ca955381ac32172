package com.propertyintel.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes that change between crawls and are versioned as snapshots.
 * Everything in here feeds the content fingerprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolatileFields {

    /** Listing status as shown on the site, e.g. "available", "verhuurd" */
    private String status;

    /** Rent per month or asking price, depending on category */
    private BigDecimal price;

    private BigDecimal floorArea;
    private BigDecimal plotArea;
    private Integer numberOfRooms;
    private Integer numberOfBedrooms;
    private String energyLabel;

    /**
     * Free-form detail page attributes (description, deposit, heating, ...).
     * Stored as JSON next to the snapshot.
     */
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
