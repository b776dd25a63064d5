package com.troveindexer.api.controller;

import com.troveindexer.api.dto.IndexerStatusResponse;
import com.troveindexer.ingestion.job.IndexerStatus;
import com.troveindexer.ingestion.job.TailingScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/indexer/status: tailing loop state, cursor and last observed head.
 */
@RestController
@RequestMapping("/api/v1/indexer")
@RequiredArgsConstructor
public class IndexerController {

    private final TailingScheduler tailingScheduler;

    @GetMapping("/status")
    public ResponseEntity<IndexerStatusResponse> status() {
        IndexerStatus s = tailingScheduler.status();
        return ResponseEntity.ok(new IndexerStatusResponse(
                s.state().name().toLowerCase(),
                s.lastProcessedBlock(),
                s.nextBlock(),
                s.lastHead(),
                s.lastBatchAt(),
                s.lastError()));
    }
}
