package com.propertyintel.listings.web;

import com.propertyintel.listings.model.IngestionBatchResult;
import com.propertyintel.listings.model.RawObservation;
import com.propertyintel.listings.service.ObservationBatchProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Entry point for the crawler: a batch of parsed listing pages.
 */
@RestController
@RequiredArgsConstructor
public class ObservationController {

    private final ObservationBatchProcessor batchProcessor;

    @PostMapping("/observations")
    public ResponseEntity<IngestionBatchResult> ingest(@RequestBody List<RawObservation> observations) {
        return ResponseEntity.ok(batchProcessor.process(observations));
    }
}
