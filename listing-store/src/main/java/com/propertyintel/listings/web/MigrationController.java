package com.propertyintel.listings.web;

import com.propertyintel.listings.migration.CutoverPreflight;
import com.propertyintel.listings.migration.CutoverResult;
import com.propertyintel.listings.migration.MigrationCoordinator;
import com.propertyintel.listings.model.Category;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator triggers for moving a category off the legacy flat tables.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class MigrationController {

    private final MigrationCoordinator migrationCoordinator;

    @PostMapping("/migration/{category}/backfill")
    public ResponseEntity<Map<String, String>> backfill(@PathVariable String category) {
        Category parsed = Category.parse(category);
        new Thread(() -> {
            try {
                migrationCoordinator.backfill(parsed);
            } catch (Exception e) {
                log.error("Manual backfill of {} failed: {}", parsed, e.getMessage(), e);
            }
        }, "manual-backfill-" + parsed.tablePrefix()).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "category", parsed.name()));
    }

    @GetMapping("/migration/{category}/preflight")
    public ResponseEntity<CutoverPreflight> preflight(@PathVariable String category) {
        return ResponseEntity.ok(migrationCoordinator.preflight(Category.parse(category)));
    }

    @PostMapping("/migration/{category}/cutover")
    public ResponseEntity<CutoverResult> cutover(
            @PathVariable String category,
            @RequestParam(defaultValue = "false") boolean backupConfirmed) {
        return ResponseEntity.ok(migrationCoordinator.cutover(Category.parse(category), backupConfirmed));
    }
}
