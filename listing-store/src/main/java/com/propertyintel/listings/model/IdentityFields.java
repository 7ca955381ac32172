package com.propertyintel.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Slow-changing attributes of a physical listing.
 *
 * Schema design notes:
 *  - not versioned: the most recent observation (by timestamp) wins
 *  - address layout follows the Funda search response (wijk = district)
 *  - lat/lng stored as-is, no geo index
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentityFields {

    // ── Address ─────────────────────────────────────────────────────────────
    private String country;
    private String province;
    private String city;
    private String municipality;
    private String district;
    private String neighbourhood;
    private String street;
    private String houseNumber;
    private String houseNumberSuffix;
    private String postalCode;

    /** True when the address is a registered BAG address */
    private Boolean bagAddress;

    // ── Location ────────────────────────────────────────────────────────────
    private BigDecimal latitude;
    private BigDecimal longitude;

    // ── Building ────────────────────────────────────────────────────────────
    /** e.g. apartment, house */
    private String propertyType;

    private Integer constructionYear;
}
