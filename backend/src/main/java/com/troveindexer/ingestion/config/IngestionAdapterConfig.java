package com.troveindexer.ingestion.config;

import com.troveindexer.common.RetryPolicy;
import com.troveindexer.ingestion.adapter.RpcEndpointRotator;
import com.troveindexer.ingestion.adapter.evm.EvmRpcClient;
import com.troveindexer.ingestion.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the ledger RPC client: endpoint rotator with retry policy, WebClient transport, local rate limiter.
 */
@Configuration
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy rpcRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public RpcEndpointRotator ledgerRpcEndpointRotator(IngestionRpcProperties rpcProperties, RetryPolicy rpcRetryPolicy) {
        return new RpcEndpointRotator(rpcProperties.getUrls(), rpcRetryPolicy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(Math.max(1L, rpcProperties.getTimeoutMs())));
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(IngestionEvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
