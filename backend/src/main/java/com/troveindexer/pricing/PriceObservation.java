package com.troveindexer.pricing;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A price as served to the metrics API.
 *
 * @param rawPrice    fixed-point value as returned by the feed
 * @param price       rawPrice scaled by the configured price decimals
 * @param feedFrozen  true when the live call reverted with the frozen-feed error and the stored record was used
 * @param lastUpdated unix seconds of the stored record; null for live prices
 */
public record PriceObservation(
        String asset,
        BigInteger rawPrice,
        BigDecimal price,
        boolean feedFrozen,
        Long lastUpdated
) {
}
