package com.troveindexer.api.controller;

import com.troveindexer.api.dto.MetricsResponse;
import com.troveindexer.api.dto.OracleDebugResponse;
import com.troveindexer.pricing.OraclePriceRecord;
import com.troveindexer.query.SystemMetrics;
import com.troveindexer.query.SystemMetricsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * System metrics valued at the oracle price, plus a diagnostic view of the stored oracle record.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MetricsController {

    private final SystemMetricsService systemMetricsService;

    @GetMapping("/metrics")
    public ResponseEntity<MetricsResponse> metrics() {
        SystemMetrics m = systemMetricsService.currentMetrics();
        return ResponseEntity.ok(new MetricsResponse(
                m.symbol(),
                m.asset(),
                m.price(),
                m.feedFrozen(),
                m.priceLastUpdated(),
                m.totalCollateral(),
                m.totalDebt(),
                m.collateralValue(),
                m.totalCollateralRatio(),
                m.activePositions()));
    }

    @GetMapping("/debug/oracle")
    public ResponseEntity<OracleDebugResponse> oracle() {
        OraclePriceRecord r = systemMetricsService.oracleRecord();
        return ResponseEntity.ok(new OracleDebugResponse(r.asset(), new OracleDebugResponse.PriceRecord(
                r.scaledPrice().toString(),
                r.timestamp(),
                r.lastUpdated(),
                r.roundId().toString())));
    }
}
