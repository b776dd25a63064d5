package com.troveindexer.ingestion.position;

/**
 * A lifecycle event that cannot be applied to the current position state. Reported and dropped; retrying
 * would reproduce the same outcome.
 */
public abstract class LifecycleException extends RuntimeException {

    private final String walletAddress;
    private final String asset;

    protected LifecycleException(String message, String walletAddress, String asset) {
        super(message);
        this.walletAddress = walletAddress;
        this.asset = asset;
    }

    public String getWalletAddress() {
        return walletAddress;
    }

    public String getAsset() {
        return asset;
    }
}
