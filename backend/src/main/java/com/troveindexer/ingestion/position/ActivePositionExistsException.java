package com.troveindexer.ingestion.position;

/**
 * Opened for a pair that already has an active position.
 */
public class ActivePositionExistsException extends LifecycleException {

    private final long positionId;

    public ActivePositionExistsException(long positionId, String walletAddress, String asset) {
        super("Active position " + positionId + " already exists for wallet=" + walletAddress + " asset=" + asset,
                walletAddress, asset);
        this.positionId = positionId;
    }

    public long getPositionId() {
        return positionId;
    }
}
