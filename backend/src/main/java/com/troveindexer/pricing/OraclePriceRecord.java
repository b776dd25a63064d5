package com.troveindexer.pricing;

import java.math.BigInteger;

/**
 * The feed's stored {@code priceRecords(asset)} struct: scaledPrice uint96, timestamp uint32,
 * lastUpdated uint32, roundId uint80.
 */
public record OraclePriceRecord(
        String asset,
        BigInteger scaledPrice,
        long timestamp,
        long lastUpdated,
        BigInteger roundId
) {

    public boolean isEmpty() {
        return scaledPrice.signum() == 0;
    }
}
