package com.troveindexer.ingestion.pipeline;

/**
 * Counters for one processed batch.
 *
 * @param logs       raw logs returned for the range
 * @param decoded    logs resolved and decoded into domain events
 * @param folded     TroveUpdated events that changed position state
 * @param skipped    logs dropped: undecodable payloads and lifecycle rejections
 */
public record BatchResult(int logs, int decoded, int folded, int skipped) {

    public static final BatchResult EMPTY = new BatchResult(0, 0, 0, 0);
}
