package com.troveindexer.ingestion.adapter;

import java.util.Comparator;
import java.util.List;

/**
 * One log entry as returned by eth_getLogs. topics[0] is the event signature hash; data is the
 * 0x-prefixed ABI-encoded non-indexed payload.
 */
public record RawLog(
        String address,
        List<String> topics,
        String data,
        String txHash,
        long blockNumber,
        long logIndex
) {

    /** Ledger order: block number, then log index. */
    public static final Comparator<RawLog> LEDGER_ORDER =
            Comparator.comparingLong(RawLog::blockNumber).thenComparingLong(RawLog::logIndex);

    public RawLog {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }

    public String signatureTopic() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
