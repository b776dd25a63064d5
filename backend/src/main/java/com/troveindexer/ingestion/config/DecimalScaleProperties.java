package com.troveindexer.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-point scale of collateral and debt amounts, per asset. Assets without an entry use the defaults.
 */
@ConfigurationProperties(prefix = "troveindexer.ingestion.decimals")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DecimalScaleProperties {

    public static final int MAX_DECIMALS = 36;

    @Min(0)
    @Max(MAX_DECIMALS)
    private int defaultCollateral = 18;

    @Min(0)
    @Max(MAX_DECIMALS)
    private int defaultDebt = 18;

    /** Key: asset address (any case). */
    @Valid
    private Map<String, AssetScale> assets = new HashMap<>();

    public void setAssets(Map<String, AssetScale> assets) {
        this.assets = assets != null ? assets : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class AssetScale {

        @Min(0)
        @Max(MAX_DECIMALS)
        private Integer collateral;

        @Min(0)
        @Max(MAX_DECIMALS)
        private Integer debt;
    }
}
