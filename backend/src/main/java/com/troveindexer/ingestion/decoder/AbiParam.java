package com.troveindexer.ingestion.decoder;

/**
 * One event input: ABI name, type, and whether it travels as a topic.
 */
public record AbiParam(String name, AbiType type, boolean indexed) {
}
