package com.troveindexer.ingestion.position;

/**
 * Non-opening event for a (wallet, asset) pair with no matching record.
 */
public class PositionNotFoundException extends LifecycleException {

    public PositionNotFoundException(String walletAddress, String asset) {
        super("No position for wallet=" + walletAddress + " asset=" + asset, walletAddress, asset);
    }
}
