package com.troveindexer.ingestion.position;

import com.troveindexer.domain.PositionStatus;

import java.math.BigDecimal;

/**
 * Mutable fields of a position as of one observation.
 */
public record PositionState(
        BigDecimal collateral,
        BigDecimal debt,
        BigDecimal healthRatio,
        PositionStatus status,
        long blockNumber
) {
}
