package com.troveindexer.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One immutable audit record appended to {@link Position#getHistory()}. (txHash, logIndex) identifies the
 * source log and makes re-application of the same log detectable.
 */
public record HistoryEntry(
        String txHash,
        long logIndex,
        BigDecimal collateral,
        BigDecimal debt,
        LifecycleOperation operation,
        Instant timestamp,
        long blockNumber
) {

    public boolean isFrom(String otherTxHash, long otherLogIndex) {
        return logIndex == otherLogIndex && txHash != null && txHash.equalsIgnoreCase(otherTxHash);
    }
}
