package com.propertyintel.listings.migration;

import com.propertyintel.listings.model.Category;

import java.time.Instant;
import java.util.List;

public record CutoverResult(Category category, List<String> liveTables, long listings, long snapshots,
                            Instant completedAt) {
}
