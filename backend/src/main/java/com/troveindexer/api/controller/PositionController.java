package com.troveindexer.api.controller;

import com.troveindexer.api.dto.ErrorBody;
import com.troveindexer.api.dto.HistoryEntryResponse;
import com.troveindexer.api.dto.PositionListResponse;
import com.troveindexer.api.dto.PositionResponse;
import com.troveindexer.domain.HistoryEntry;
import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionStatus;
import com.troveindexer.query.PositionQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.regex.Pattern;

/**
 * GET /api/v1/positions/{positionId} with full history; GET /api/v1/positions?wallet=&asset=&status= for
 * current state of matching positions.
 */
@RestController
@RequestMapping("/api/v1/positions")
@RequiredArgsConstructor
public class PositionController {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private final PositionQueryService positionQueryService;

    @GetMapping("/{positionId}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable long positionId) {
        return ResponseEntity.ok(toResponse(positionQueryService.getPosition(positionId), true));
    }

    @GetMapping
    public ResponseEntity<?> search(
            @RequestParam(required = false) String wallet,
            @RequestParam(required = false) String asset,
            @RequestParam(required = false) String status
    ) {
        if (wallet != null && !ADDRESS.matcher(wallet.strip()).matches()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address format"));
        }
        if (asset != null && !ADDRESS.matcher(asset.strip()).matches()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid asset address format"));
        }
        PositionStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            try {
                statusFilter = PositionStatus.valueOf(status.strip().toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_STATUS",
                        "status must be one of active, closed, liquidated"));
            }
        }
        List<PositionResponse> items = positionQueryService.search(wallet, asset, statusFilter).stream()
                .map(p -> toResponse(p, false))
                .toList();
        return ResponseEntity.ok(new PositionListResponse(items, items.size()));
    }

    static PositionResponse toResponse(Position p, boolean withHistory) {
        return new PositionResponse(
                p.getPositionId(),
                p.getWalletAddress(),
                p.getAsset(),
                p.getCollateral(),
                p.getDebt(),
                p.getHealthRatio(),
                p.getStatus() != null ? p.getStatus().value() : null,
                p.getBlockNumber(),
                withHistory ? p.getHistory().stream().map(PositionController::toResponse).toList() : null);
    }

    private static HistoryEntryResponse toResponse(HistoryEntry h) {
        return new HistoryEntryResponse(
                h.txHash(),
                h.logIndex(),
                h.blockNumber(),
                h.operation() != null ? h.operation().name().toLowerCase() : null,
                h.collateral(),
                h.debt(),
                h.timestamp());
    }
}
