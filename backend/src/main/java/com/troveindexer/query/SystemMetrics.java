package com.troveindexer.query;

import java.math.BigDecimal;

/**
 * System-wide totals over active positions, valued at the oracle price.
 *
 * @param totalCollateralRatio collateral value / total debt; 0 when there is no debt
 */
public record SystemMetrics(
        String symbol,
        String asset,
        BigDecimal price,
        boolean feedFrozen,
        Long priceLastUpdated,
        BigDecimal totalCollateral,
        BigDecimal totalDebt,
        BigDecimal collateralValue,
        BigDecimal totalCollateralRatio,
        long activePositions
) {
}
