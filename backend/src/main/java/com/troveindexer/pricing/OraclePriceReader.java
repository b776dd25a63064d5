package com.troveindexer.pricing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.troveindexer.config.CaffeineConfig;
import com.troveindexer.ingestion.adapter.RpcEndpointRotator;
import com.troveindexer.ingestion.adapter.RpcException;
import com.troveindexer.ingestion.adapter.evm.EvmRpcClient;
import com.troveindexer.pricing.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Two-tier oracle read via eth_call on the price feed. {@code fetchPrice(asset)} first; when it reverts with
 * {@code PriceFeed__FeedFrozenError} or answers zero, the stored {@code priceRecords(asset)} is used instead.
 * Any other failure is a {@link PriceUnavailableException}; nothing is defaulted.
 */
@Component
@Slf4j
public class OraclePriceReader {

    static final String FETCH_PRICE_SELECTOR = FunctionEncoder.buildMethodId("fetchPrice(address)");
    static final String PRICE_RECORDS_SELECTOR = FunctionEncoder.buildMethodId("priceRecords(address)");
    static final String FEED_FROZEN_ERROR = "PriceFeed__FeedFrozenError";
    static final String FEED_FROZEN_SELECTOR = FunctionEncoder.buildMethodId(FEED_FROZEN_ERROR + "(address)");

    private static final int WORD_HEX = 64;

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final PricingProperties pricingProperties;
    private final ObjectMapper objectMapper;

    public OraclePriceReader(
            EvmRpcClient rpcClient,
            @Qualifier("ledgerRpcEndpointRotator") RpcEndpointRotator rotator,
            PricingProperties pricingProperties,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.pricingProperties = pricingProperties;
        this.objectMapper = objectMapper;
    }

    @Cacheable(cacheNames = CaffeineConfig.ORACLE_PRICE_CACHE, key = "#asset.toLowerCase()")
    public PriceObservation readPrice(String asset) {
        boolean frozen = false;
        try {
            BigInteger live = firstWord(ethCall(FETCH_PRICE_SELECTOR, asset), "fetchPrice");
            if (live.signum() > 0) {
                return new PriceObservation(asset.toLowerCase(), live, scale(live), false, null);
            }
            log.warn("fetchPrice({}) returned 0; falling back to priceRecords", asset);
        } catch (ContractCallRevertedException e) {
            if (!isFeedFrozen(e)) {
                throw new PriceUnavailableException("fetchPrice(" + asset + ") reverted: " + e.getMessage(), e);
            }
            frozen = true;
            log.warn("Price feed frozen for {}; falling back to priceRecords", asset);
        } catch (RpcException e) {
            throw new PriceUnavailableException("fetchPrice(" + asset + ") failed: " + e.getMessage(), e);
        }

        OraclePriceRecord stored = fetchRecord(asset);
        if (stored.isEmpty()) {
            throw new PriceUnavailableException("No stored price record for " + asset);
        }
        return new PriceObservation(asset.toLowerCase(), stored.scaledPrice(), scale(stored.scaledPrice()), frozen,
                stored.lastUpdated() != 0 ? stored.lastUpdated() : stored.timestamp());
    }

    @Cacheable(cacheNames = CaffeineConfig.ORACLE_RECORD_CACHE, key = "#asset.toLowerCase()")
    public OraclePriceRecord readPriceRecord(String asset) {
        return fetchRecord(asset);
    }

    private OraclePriceRecord fetchRecord(String asset) {
        String result;
        try {
            result = ethCall(PRICE_RECORDS_SELECTOR, asset);
        } catch (RpcException e) {
            throw new PriceUnavailableException("priceRecords(" + asset + ") failed: " + e.getMessage(), e);
        }
        return decodePriceRecord(asset, result);
    }

    BigDecimal scale(BigInteger raw) {
        return new BigDecimal(raw).movePointLeft(pricingProperties.getPriceDecimals());
    }

    static boolean isFeedFrozen(ContractCallRevertedException e) {
        String data = e.getErrorData();
        if (data != null && data.toLowerCase().startsWith(FEED_FROZEN_SELECTOR)) {
            return true;
        }
        return e.getMessage() != null && e.getMessage().contains(FEED_FROZEN_ERROR);
    }

    static OraclePriceRecord decodePriceRecord(String asset, String result) {
        String hex = strip0x(result);
        if (hex.length() < 4 * WORD_HEX) {
            throw new PriceUnavailableException("priceRecords(" + asset + ") returned " + hex.length() / 2 + " bytes");
        }
        return new OraclePriceRecord(
                asset.toLowerCase(),
                word(hex, 0),
                word(hex, 1).longValueExact(),
                word(hex, 2).longValueExact(),
                word(hex, 3));
    }

    static String encodeAddressCall(String selector, String address) {
        String addr = strip0x(address).toLowerCase();
        return selector + "0".repeat(WORD_HEX - addr.length()) + addr;
    }

    private String ethCall(String selector, String asset) {
        List<Object> params = List.of(
                Map.of("to", pricingProperties.getPriceFeedAddress(), "data", encodeAddressCall(selector, asset)),
                "latest");
        RpcException last = null;
        int attempts = Math.max(1, rotator.getMaxAttempts());
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = rotator.getNextEndpoint();
            String json;
            try {
                json = rpcClient.call(endpoint, "eth_call", params).block();
            } catch (RpcException e) {
                last = e;
                log.debug("eth_call {} failed on {} (attempt {}): {}", selector, endpoint, attempt + 1, e.getMessage());
                continue;
            }
            return resultOf(json);
        }
        throw new RpcException("eth_call " + selector + " failed after " + attempts + " attempts", last);
    }

    private String resultOf(String json) {
        if (json == null) {
            throw new RpcException("eth_call returned null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse eth_call response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ContractCallRevertedException(error.path("message").asText(error.toString()),
                    error.path("code").isNumber() ? error.path("code").asInt() : null,
                    error.path("data").isTextual() ? error.path("data").asText() : null);
        }
        String result = root.path("result").asText(null);
        if (result == null || !result.startsWith("0x")) {
            throw new RpcException("eth_call invalid result: " + result);
        }
        return result;
    }

    private static BigInteger firstWord(String result, String function) {
        String hex = strip0x(result);
        if (hex.length() < WORD_HEX) {
            throw new RpcException(function + " returned " + hex.length() / 2 + " bytes");
        }
        return word(hex, 0);
    }

    private static BigInteger word(String hex, int index) {
        return new BigInteger(hex.substring(index * WORD_HEX, (index + 1) * WORD_HEX), 16);
    }

    private static String strip0x(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
