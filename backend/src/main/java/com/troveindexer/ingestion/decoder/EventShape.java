package com.troveindexer.ingestion.decoder;

import java.util.List;

/**
 * Named, typed event layout resolved from (contract address, topic 0).
 */
public record EventShape(String contractName, String name, String signature, String topicHash, List<AbiParam> inputs) {

    public EventShape {
        inputs = List.copyOf(inputs);
    }

    /** Inputs ABI-encoded in the log data, in declaration order. */
    public List<AbiParam> nonIndexed() {
        return inputs.stream().filter(p -> !p.indexed()).toList();
    }
}
