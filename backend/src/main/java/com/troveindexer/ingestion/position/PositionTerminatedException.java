package com.troveindexer.ingestion.position;

import com.troveindexer.domain.PositionStatus;

/**
 * Update aimed at a pair whose most recent record is already closed or liquidated. A fresh Opened is required.
 */
public class PositionTerminatedException extends LifecycleException {

    private final long positionId;

    public PositionTerminatedException(long positionId, PositionStatus status, String walletAddress, String asset) {
        super("Position " + positionId + " is " + status.value() + "; update for wallet=" + walletAddress
                + " asset=" + asset + " rejected", walletAddress, asset);
        this.positionId = positionId;
    }

    public long getPositionId() {
        return positionId;
    }
}
