package com.troveindexer.api.dto;

import java.math.BigDecimal;

/**
 * GET /api/v1/metrics. {@code tcr} is the total collateral ratio (collateral value over total debt).
 */
public record MetricsResponse(
        String token,
        String asset,
        BigDecimal price,
        boolean feedFrozen,
        Long priceLastUpdated,
        BigDecimal totalColl,
        BigDecimal totalDebt,
        BigDecimal collUsd,
        BigDecimal tcr,
        long activePositions
) {
}
