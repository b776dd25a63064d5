package com.troveindexer.ingestion.position;

import com.troveindexer.ingestion.config.DecimalScaleProperties;
import com.troveindexer.ingestion.config.DecimalScaleProperties.AssetScale;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts raw fixed-point amounts to decimals using the configured per-asset scale. Results are rounded
 * to 34 significant digits, the precision of the Decimal128 column they are stored in.
 */
@Component
public class DecimalScaleResolver {

    private final int defaultCollateral;
    private final int defaultDebt;
    private final Map<String, AssetScale> byAsset = new HashMap<>();

    public DecimalScaleResolver(DecimalScaleProperties properties) {
        this.defaultCollateral = requireInRange(properties.getDefaultCollateral(), "default-collateral");
        this.defaultDebt = requireInRange(properties.getDefaultDebt(), "default-debt");
        properties.getAssets().forEach((asset, scale) -> {
            if (scale.getCollateral() != null) {
                requireInRange(scale.getCollateral(), asset + ".collateral");
            }
            if (scale.getDebt() != null) {
                requireInRange(scale.getDebt(), asset + ".debt");
            }
            byAsset.put(asset.toLowerCase(), scale);
        });
    }

    public int collateralDecimals(String asset) {
        AssetScale scale = asset == null ? null : byAsset.get(asset.toLowerCase());
        return scale != null && scale.getCollateral() != null ? scale.getCollateral() : defaultCollateral;
    }

    public int debtDecimals(String asset) {
        AssetScale scale = asset == null ? null : byAsset.get(asset.toLowerCase());
        return scale != null && scale.getDebt() != null ? scale.getDebt() : defaultDebt;
    }

    public BigDecimal collateral(String asset, BigInteger raw) {
        return scale(raw, collateralDecimals(asset));
    }

    public BigDecimal debt(String asset, BigInteger raw) {
        return scale(raw, debtDecimals(asset));
    }

    static BigDecimal scale(BigInteger raw, int decimals) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(raw).movePointLeft(decimals).round(MathContext.DECIMAL128);
    }

    private static int requireInRange(int decimals, String key) {
        if (decimals < 0 || decimals > DecimalScaleProperties.MAX_DECIMALS) {
            throw new IllegalArgumentException("Decimal scale " + key + " must be within [0, "
                    + DecimalScaleProperties.MAX_DECIMALS + "], got " + decimals);
        }
        return decimals;
    }
}
