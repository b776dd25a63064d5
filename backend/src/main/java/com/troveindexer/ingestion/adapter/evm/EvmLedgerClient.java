package com.troveindexer.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.troveindexer.ingestion.adapter.LedgerClient;
import com.troveindexer.ingestion.adapter.RawLog;
import com.troveindexer.ingestion.adapter.RpcEndpointRotator;
import com.troveindexer.ingestion.adapter.RpcException;
import com.troveindexer.ingestion.adapter.TransientFetchException;
import com.troveindexer.ingestion.config.IngestionEvmRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * EVM ledger client: eth_blockNumber for the head, eth_getLogs filtered by the watched contract addresses
 * for a block range. Failover across endpoints inside one call; a range the node rejects as too wide is
 * split in halves and stitched back together in ledger order.
 */
@Slf4j
@Component
public class EvmLedgerClient implements LedgerClient {

    static final long MIN_SPLIT_SPAN = 1;

    private final Map<String, Long> endpointCooldownUntilMs = new ConcurrentHashMap<>();

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter evmRpcRateLimiter;
    private final IngestionEvmRpcProperties evmRpcProperties;
    private final ObjectMapper objectMapper;

    public EvmLedgerClient(
            EvmRpcClient rpcClient,
            @Qualifier("ledgerRpcEndpointRotator") RpcEndpointRotator rotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            IngestionEvmRpcProperties evmRpcProperties,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.evmRpcProperties = evmRpcProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public long currentHead() {
        return withRetry("eth_blockNumber", endpoint -> {
            JsonNode result = resultOf(callRpc(endpoint, "eth_blockNumber", Collections.emptyList()), "eth_blockNumber");
            String hex = result.asText(null);
            if (hex == null || !hex.startsWith("0x")) {
                throw new RpcException("eth_blockNumber invalid result: " + hex);
            }
            return parseHexLong(hex);
        });
    }

    @Override
    public List<RawLog> queryLogs(long fromBlock, long toBlock, List<String> addresses) {
        if (fromBlock < 0 || toBlock < fromBlock) {
            throw new IllegalArgumentException("Invalid block range [" + fromBlock + ", " + toBlock + "]");
        }
        if (addresses == null || addresses.isEmpty()) {
            throw new IllegalArgumentException("At least one contract address required");
        }
        List<RawLog> logs = new ArrayList<>(fetchRange(fromBlock, toBlock, addresses));
        logs.sort(RawLog.LEDGER_ORDER);
        return logs;
    }

    private List<RawLog> fetchRange(long fromBlock, long toBlock, List<String> addresses) {
        try {
            return withRetry("eth_getLogs [" + fromBlock + "-" + toBlock + "]",
                    endpoint -> ethGetLogs(endpoint, fromBlock, toBlock, addresses));
        } catch (TransientFetchException e) {
            if (isRangeTooWideError(e.getCause()) && (toBlock - fromBlock) >= MIN_SPLIT_SPAN) {
                long mid = fromBlock + (toBlock - fromBlock) / 2;
                log.warn("Reducing block range [{}-{}] to [{}-{}] + [{}-{}] due to RPC limitation: {}",
                        fromBlock, toBlock, fromBlock, mid, mid + 1, toBlock, messageOf(e.getCause()));
                List<RawLog> combined = new ArrayList<>(fetchRange(fromBlock, mid, addresses));
                combined.addAll(fetchRange(mid + 1, toBlock, addresses));
                return combined;
            }
            throw e;
        }
    }

    private <T> T withRetry(String what, Function<String, T> call) {
        Exception lastException = null;
        for (int attempt = 0; attempt < Math.max(1, rotator.getMaxAttempts()); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransientFetchException("Interrupted during retry of " + what, e);
                }
            }
            String endpoint = nextEndpoint();
            try {
                return call.apply(endpoint);
            } catch (Exception e) {
                lastException = e;
                if (isRangeTooWideError(e)) {
                    break;
                }
                if (isRateLimited(e)) {
                    markEndpointCoolingDown(endpoint, e);
                }
                log.debug("{} failed on {} (attempt {}): {}", what, endpoint, attempt + 1, messageOf(e));
            }
        }
        String msg = what + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        throw new TransientFetchException(msg, lastException);
    }

    private List<RawLog> ethGetLogs(String endpoint, long fromBlock, long toBlock, List<String> addresses) {
        Map<String, Object> filter = new HashMap<>();
        filter.put("fromBlock", "0x" + Long.toHexString(fromBlock));
        filter.put("toBlock", "0x" + Long.toHexString(toBlock));
        filter.put("address", addresses);
        String json = callRpc(endpoint, "eth_getLogs", Collections.singletonList(filter));
        JsonNode result = resultOf(json, "eth_getLogs");
        if (!result.isArray()) {
            throw new RpcException("eth_getLogs: expected array result, got " + result.getNodeType());
        }
        List<RawLog> logs = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            if (node.path("removed").asBoolean(false)) {
                continue;
            }
            logs.add(toRawLog(node));
        }
        return logs;
    }

    private RawLog toRawLog(JsonNode node) {
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(t.asText()));
        return new RawLog(
                node.path("address").asText("").toLowerCase(),
                topics,
                node.path("data").asText("0x"),
                node.path("transactionHash").asText(null),
                parseHexLong(node.path("blockNumber").asText("0x0")),
                parseHexLong(node.path("logIndex").asText("0x0")));
    }

    private JsonNode resultOf(String json, String method) {
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            Integer code = error.path("code").isNumber() ? error.path("code").asInt() : null;
            throw new RpcException(method + " error " + code + ": " + error.path("message").asText(error.toString()),
                    code, error.path("data").isTextual() ? error.path("data").asText() : null);
        }
        return root.path("result");
    }

    private String callRpc(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = evmRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, evmRpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        return rpcClient.call(endpoint, method, params).block();
    }

    private String nextEndpoint() {
        long nowMs = System.currentTimeMillis();
        return rotator.nextAvailable(endpoint -> {
            Long cooldownUntil = endpointCooldownUntilMs.get(endpoint);
            if (cooldownUntil == null || cooldownUntil <= nowMs) {
                return false;
            }
            log.debug("Skipping cooled-down endpoint {} for {} ms", endpoint, cooldownUntil - nowMs);
            return true;
        });
    }

    private void markEndpointCoolingDown(String endpoint, Exception cause) {
        long cooldownMs = Math.max(1_000L, evmRpcProperties.getEndpointCooldownMs());
        endpointCooldownUntilMs.put(endpoint, System.currentTimeMillis() + cooldownMs);
        log.warn("RPC endpoint {} rate-limited; cooling down for {} ms. cause={}", endpoint, cooldownMs, messageOf(cause));
    }

    static long parseHexLong(String hex) {
        if (hex == null || hex.isBlank()) {
            return 0L;
        }
        String h = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return h.isEmpty() ? 0L : Long.parseLong(h, 16);
    }

    public static boolean isRangeTooWideError(Throwable e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("query returned more than") || msg.contains("too many results")
                || msg.contains("block range is too wide") || msg.contains("exceed maximum block range")
                || msg.contains("log response size exceeded") || msg.contains("block range too large");
    }

    static boolean isRateLimited(Throwable e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("request limit") || msg.contains("-32005");
    }

    private static String messageOf(Throwable e) {
        if (e == null) return "null";
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
