package com.troveindexer.domain;

import java.util.List;
import java.util.Optional;

/**
 * Provenance of a decoded event: emitting contract, source tx/log position and the indexed topics
 * (topic 0, the event signature, excluded).
 */
public record LogMeta(
        String contractAddress,
        String txHash,
        long blockNumber,
        long logIndex,
        List<String> indexedTopics
) {

    public LogMeta {
        indexedTopics = indexedTopics != null ? List.copyOf(indexedTopics) : List.of();
    }

    /**
     * Indexed topic by its 1-based position in the raw log (1 = first indexed field).
     * Empty when the log carries fewer indexed fields.
     */
    public Optional<String> topic(int position) {
        int i = position - 1;
        if (i < 0 || i >= indexedTopics.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(indexedTopics.get(i));
    }
}
