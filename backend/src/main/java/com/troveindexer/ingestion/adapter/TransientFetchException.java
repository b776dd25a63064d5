package com.troveindexer.ingestion.adapter;

/**
 * Ledger query failed after all endpoint attempts (network, timeout, rate limit). The whole range attempt is
 * discarded; the tailing loop retries the same range later.
 */
public class TransientFetchException extends RpcException {

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
