package com.propertyintel.listings.migration;

import com.propertyintel.listings.model.IdentityFields;
import com.propertyintel.listings.model.VolatileFields;

import java.time.Instant;

/**
 * One legacy crawl record with its details row folded in.
 */
public record LegacyRow(long recordId, long propertyId, Instant createdAt,
                        IdentityFields identity, VolatileFields fields) {
}
