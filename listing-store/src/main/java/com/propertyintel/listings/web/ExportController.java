package com.propertyintel.listings.web;

import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.output.ListingCsvExporter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ExportController {

    private final ListingCsvExporter csvExporter;

    @PostMapping("/export/{category}")
    public ResponseEntity<Map<String, String>> export(@PathVariable String category) {
        Category parsed = Category.parse(category);
        Path file = csvExporter.exportCurrent(parsed);
        return ResponseEntity.ok(Map.of("category", parsed.name(), "file", file.toString()));
    }
}
