package com.troveindexer.ingestion.adapter.evm;

import com.troveindexer.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * EVM JSON-RPC client using WebClient. Used by EvmLedgerClient and the oracle reader.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e));
    }
}
