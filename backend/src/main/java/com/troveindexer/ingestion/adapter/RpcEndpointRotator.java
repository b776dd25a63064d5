package com.troveindexer.ingestion.adapter;

import com.troveindexer.common.RetryPolicy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Round-robin over the configured ledger RPC endpoints, plus the backoff policy for failover between them.
 * Endpoints are trimmed and de-duplicated; configuration order is kept.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger cursor = new AtomicInteger();
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        Set<String> distinct = new LinkedHashSet<>();
        if (endpoints != null) {
            for (String e : endpoints) {
                if (e != null && !e.isBlank()) {
                    distinct.add(e.strip());
                }
            }
        }
        if (distinct.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(distinct);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        return endpoints.get(Math.floorMod(cursor.getAndIncrement(), endpoints.size()));
    }

    /**
     * Next endpoint in rotation that is not {@code unavailable}. When every endpoint is unavailable the
     * plain next one is returned, so callers always get something to try.
     */
    public String nextAvailable(Predicate<String> unavailable) {
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = getNextEndpoint();
            if (!unavailable.test(endpoint)) {
                return endpoint;
            }
        }
        return getNextEndpoint();
    }

    /** Pause before the attempt following {@code attempt} (0-based). */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
