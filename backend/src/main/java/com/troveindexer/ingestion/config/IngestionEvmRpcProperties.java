package com.troveindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Local throttle for ledger RPC calls and the pause applied to an endpoint that reports rate limiting.
 */
@ConfigurationProperties(prefix = "troveindexer.ingestion.evm-rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionEvmRpcProperties {

    /** Requests per second shared by eth_blockNumber and eth_getLogs. */
    @Min(1)
    private int maxRequestsPerSecond = 25;

    /** An endpoint answering 429 / -32005 is skipped for this long. */
    @Min(0)
    private long endpointCooldownMs = 60_000;

    /** Limiter waits at least this long are logged at info. */
    @Min(0)
    private long localLimiterLogThresholdMs = 100;

    /** Longest wait for a permit before the call fails. */
    @Min(0)
    private long localLimiterTimeoutMs = 5_000;
}
