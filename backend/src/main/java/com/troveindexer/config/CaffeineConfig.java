package com.troveindexer.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Oracle reads are cached briefly so dashboards polling /metrics
 * do not turn into one eth_call per request.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String ORACLE_PRICE_CACHE = "oraclePriceCache";
    public static final String ORACLE_RECORD_CACHE = "oracleRecordCache";

    @Bean
    public CacheManager caffeineCacheManager(
            @Value("${troveindexer.pricing.cache-ttl-ms:15000}") long priceTtlMs) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ORACLE_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(priceTtlMs, TimeUnit.MILLISECONDS)
                .maximumSize(100)
                .build());
        manager.registerCustomCache(ORACLE_RECORD_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(priceTtlMs, TimeUnit.MILLISECONDS)
                .maximumSize(100)
                .build());
        return manager;
    }
}
