package com.troveindexer.ingestion.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Endpoint failover inside one ledger query. Once {@code maxAttempts} are spent the query fails with
 * TransientFetchException and the tailing loop retries the range on its own interval.
 */
@ConfigurationProperties(prefix = "troveindexer.ingestion.retry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Pause before the second attempt in ms; doubled for each further attempt. */
    @Min(0)
    private long baseDelayMs = 500L;

    /** Relative jitter applied to every pause, 0.2 = ±20%. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.2;

    @Min(1)
    private int maxAttempts = 3;
}
