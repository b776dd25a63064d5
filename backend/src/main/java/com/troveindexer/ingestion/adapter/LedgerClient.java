package com.troveindexer.ingestion.adapter;

import java.util.List;

/**
 * Read-only view of the ledger used by the tailing loop.
 */
public interface LedgerClient {

    /**
     * Current chain head.
     *
     * @throws TransientFetchException when no endpoint answered
     */
    long currentHead();

    /**
     * All logs emitted by {@code addresses} in [fromBlock, toBlock] (inclusive), ordered by
     * (blockNumber, logIndex). Never returns a partial range: either every log or an exception.
     *
     * @throws IllegalArgumentException   when the range is invalid
     * @throws TransientFetchException    on any RPC/network failure
     */
    List<RawLog> queryLogs(long fromBlock, long toBlock, List<String> addresses);
}
