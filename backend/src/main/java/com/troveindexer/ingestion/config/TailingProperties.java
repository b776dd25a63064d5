package com.troveindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tailing loop inputs: where to start, how many blocks per batch, and how long to wait when idle or
 * after a failed fetch.
 */
@ConfigurationProperties(prefix = "troveindexer.ingestion.tailing")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TailingProperties {

    /** Start the loop on ApplicationReadyEvent. Tests switch it off. */
    private boolean enabled = true;

    /** First block to index when no checkpoint exists. */
    @Min(0)
    private long startBlock = 0;

    /** Blocks per eth_getLogs batch. */
    @Min(1)
    private int batchSize = 500;

    /** Pause between head checks when caught up. */
    @Min(0)
    private long pollIntervalMs = 10_000;

    /** Pause before retrying a batch after a transient fetch or store failure. */
    @Min(0)
    private long retryIntervalMs = 5_000;

    /** Key of the checkpoint document in indexer_cursor. */
    @NotBlank
    private String cursorId = "trove-indexer";
}
