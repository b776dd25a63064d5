package com.troveindexer.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * One JSON-RPC request against one ledger endpoint. Endpoint choice, retries and error-object handling
 * belong to the callers ({@link EvmLedgerClient}, the oracle reader); tests substitute canned responses.
 */
public interface EvmRpcClient {

    /**
     * @param params positional params, serialised as the JSON-RPC {@code params} array
     * @return the raw response body; fails with {@code RpcException} on HTTP or connection errors only,
     * a JSON-RPC {@code error} object is returned as a normal body
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
