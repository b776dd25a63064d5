package com.troveindexer.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * Current state of one position. {@code history} is omitted from list responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PositionResponse(
        long positionId,
        String walletAddress,
        String asset,
        BigDecimal collateral,
        BigDecimal debt,
        BigDecimal healthRatio,
        String status,
        long blockNumber,
        List<HistoryEntryResponse> history
) {
}
