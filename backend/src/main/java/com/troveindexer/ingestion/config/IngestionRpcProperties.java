package com.troveindexer.ingestion.config;

import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger RPC endpoints, used round-robin with failover.
 */
@ConfigurationProperties(prefix = "troveindexer.ingestion.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    @NotEmpty
    private List<String> urls = new ArrayList<>();

    /** Per-request HTTP timeout. */
    private long timeoutMs = 20_000;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
