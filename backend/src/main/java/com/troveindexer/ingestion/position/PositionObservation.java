package com.troveindexer.ingestion.position;

import com.troveindexer.domain.HistoryEntry;
import com.troveindexer.domain.LifecycleOperation;

/**
 * Everything derived from one TroveUpdated log before it touches the store.
 */
public record PositionObservation(
        String walletAddress,
        String asset,
        LifecycleOperation operation,
        PositionState state,
        HistoryEntry historyEntry
) {
}
