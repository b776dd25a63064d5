package com.troveindexer.pricing.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Oracle used by the metrics API: the price feed contract, the collateral asset it is asked about,
 * and the fixed-point scale of its answers.
 */
@ConfigurationProperties(prefix = "troveindexer.pricing")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class PricingProperties {

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$")
    private String priceFeedAddress;

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$")
    private String assetAddress;

    /** Display symbol of the collateral asset. */
    private String symbol = "pBTC";

    /** Decimals of fetchPrice / scaledPrice values. */
    @Min(0)
    @Max(36)
    private int priceDecimals = 8;

    /** TTL of the oracle caches; read by CaffeineConfig. */
    @Min(0)
    private long cacheTtlMs = 15_000;
}
