package com.troveindexer.ingestion.position;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Debt-to-collateral ratio in percent, 2 decimals. Zero collateral yields 0, never an error.
 */
public final class HealthRatio {

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private HealthRatio() {
    }

    public static BigDecimal of(BigDecimal debt, BigDecimal collateral) {
        if (collateral == null || collateral.signum() == 0 || debt == null) {
            return ZERO;
        }
        return debt.multiply(HUNDRED).divide(collateral, SCALE, RoundingMode.HALF_UP);
    }
}
