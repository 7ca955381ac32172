package com.propertyintel.listings.migration;

import com.propertyintel.listings.model.Category;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks run before the legacy tables are dropped. Cutover only proceeds when
 * {@link #isReady()}.
 */
@Data
public class CutoverPreflight {

    private Category category;
    private boolean legacyPresent;
    private boolean stagingPresent;
    private boolean liveNamesFree;

    private long legacyRows;
    private long legacyListings;
    private long stagedListings;
    private long stagedSnapshots;
    private long stagedWithoutCurrentSnapshot;
    private long stagedQueued;

    private List<String> problems = new ArrayList<>();

    public boolean isReady() {
        return problems.isEmpty();
    }

    void problem(String message) {
        problems.add(message);
    }
}
