package com.propertyintel.listings.web;

import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.model.ListingView;
import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.service.ListingQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ListingController {

    private final ListingQueryService queryService;

    // ── Listing history ───────────────────────────────────────────────────────

    @GetMapping("/listings/{category}/{listingId}")
    public ResponseEntity<ListingView> getListing(@PathVariable String category, @PathVariable long listingId) {
        return queryService.findListing(Category.parse(category), listingId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/listings/{category}/{listingId}/snapshots")
    public ResponseEntity<List<Snapshot>> getSnapshots(@PathVariable String category, @PathVariable long listingId) {
        return ResponseEntity.ok(queryService.history(Category.parse(category), listingId));
    }

    // ── Recrawl queue ─────────────────────────────────────────────────────────

    /**
     * GET /recrawl/rent/due?asOf=2024-05-01T00:00:00Z&limit=100
     *
     * asOf defaults to now.
     */
    @GetMapping("/recrawl/{category}/due")
    public ResponseEntity<Map<String, Object>> getDue(
            @PathVariable String category,
            @RequestParam(required = false) Instant asOf,
            @RequestParam(defaultValue = "100") int limit) {
        Category parsed = Category.parse(category);
        Instant at = asOf != null ? asOf : Instant.now();
        List<Long> due = queryService.dueForRecrawl(parsed, at, limit);
        return ResponseEntity.ok(Map.of(
                "category", parsed,
                "asOf", at.toString(),
                "listingIds", due
        ));
    }
}
