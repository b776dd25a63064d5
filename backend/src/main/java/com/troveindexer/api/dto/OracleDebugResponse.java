package com.troveindexer.api.dto;

/**
 * Stored oracle record for the configured asset. Large integers are rendered as decimal strings.
 */
public record OracleDebugResponse(String token, PriceRecord priceRecord) {

    public record PriceRecord(String scaledPrice, long timestamp, long lastUpdated, String roundId) {
    }
}
