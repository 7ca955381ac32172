package com.propertyintel.listings.recrawl;

import com.propertyintel.listings.config.ListingStoreProperties;

import java.util.List;
import java.util.Locale;

/**
 * Tells whether an observed status means the listing has left the market.
 * Funda shows both English and Dutch labels ("Sold", "Verhuurd"), so matching
 * is case-insensitive and by substring.
 *
 * Conditional statuses ("Verkocht onder voorbehoud") win over terminal ones:
 * the deal can still fall through and the page stays up, so the listing keeps
 * being crawled.
 */
public class ListingStatusClassifier {

    private final List<String> inactiveStatuses;
    private final List<String> conditionalStatuses;

    public ListingStatusClassifier(List<String> inactiveStatuses) {
        this(inactiveStatuses, List.of());
    }

    public ListingStatusClassifier(List<String> inactiveStatuses, List<String> conditionalStatuses) {
        this.inactiveStatuses = normalise(inactiveStatuses);
        this.conditionalStatuses = normalise(conditionalStatuses);
    }

    public static ListingStatusClassifier from(ListingStoreProperties properties) {
        ListingStoreProperties.Recrawl recrawl = properties.getRecrawl();
        return new ListingStatusClassifier(recrawl.getInactiveStatuses(), recrawl.getConditionalStatuses());
    }

    /**
     * Unknown or missing status counts as live; only an explicit terminal status retires a listing.
     */
    public boolean isLive(String status) {
        if (status == null || status.isBlank()) {
            return true;
        }
        String normalised = status.trim().toLowerCase(Locale.ROOT);
        if (conditionalStatuses.stream().anyMatch(normalised::contains)) {
            return true;
        }
        return inactiveStatuses.stream().noneMatch(normalised::contains);
    }

    private static List<String> normalise(List<String> statuses) {
        if (statuses == null) {
            return List.of();
        }
        return statuses.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
