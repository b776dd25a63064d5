package com.troveindexer.ingestion.decoder;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping (contract address, event signature hash) to event shape. Built once at startup; lookups
 * are case-insensitive.
 */
public final class DecodingTable {

    private final Map<String, Map<String, EventShape>> shapesByAddress;

    private DecodingTable(Map<String, Map<String, EventShape>> shapesByAddress) {
        this.shapesByAddress = shapesByAddress;
    }

    public Optional<EventShape> resolve(String contractAddress, String signatureTopic) {
        if (contractAddress == null || signatureTopic == null) {
            return Optional.empty();
        }
        Map<String, EventShape> byTopic = shapesByAddress.get(contractAddress.toLowerCase());
        if (byTopic == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byTopic.get(signatureTopic.toLowerCase()));
    }

    public int size() {
        return shapesByAddress.values().stream().mapToInt(Map::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, Map<String, EventShape>> shapes = new HashMap<>();

        public Builder add(String contractAddress, EventShape shape) {
            shapes.computeIfAbsent(contractAddress.toLowerCase(), k -> new HashMap<>())
                    .put(shape.topicHash().toLowerCase(), shape);
            return this;
        }

        public DecodingTable build() {
            Map<String, Map<String, EventShape>> copy = new HashMap<>();
            shapes.forEach((address, byTopic) -> copy.put(address, Map.copyOf(byTopic)));
            return new DecodingTable(Collections.unmodifiableMap(copy));
        }
    }
}
