package com.troveindexer.query;

import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionRepository;
import com.troveindexer.domain.PositionStatus;
import com.troveindexer.pricing.OraclePriceReader;
import com.troveindexer.pricing.OraclePriceRecord;
import com.troveindexer.pricing.PriceObservation;
import com.troveindexer.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Aggregates active positions and values them with the oracle price. TCR = (totalCollateral * price) / totalDebt.
 */
@Service
@RequiredArgsConstructor
public class SystemMetricsService {

    static final int RATIO_SCALE = 8;

    private final PositionRepository positionRepository;
    private final OraclePriceReader oraclePriceReader;
    private final PricingProperties pricingProperties;

    /**
     * @throws com.troveindexer.pricing.PriceUnavailableException when no price can be read
     */
    public SystemMetrics currentMetrics() {
        PriceObservation price = oraclePriceReader.readPrice(pricingProperties.getAssetAddress());
        List<Position> active = positionRepository.findByStatus(PositionStatus.ACTIVE);
        BigDecimal totalCollateral = BigDecimal.ZERO;
        BigDecimal totalDebt = BigDecimal.ZERO;
        for (Position p : active) {
            totalCollateral = totalCollateral.add(orZero(p.getCollateral()));
            totalDebt = totalDebt.add(orZero(p.getDebt()));
        }
        BigDecimal collateralValue = totalCollateral.multiply(price.price());
        return new SystemMetrics(
                pricingProperties.getSymbol(),
                price.asset(),
                price.price(),
                price.feedFrozen(),
                price.lastUpdated(),
                totalCollateral,
                totalDebt,
                collateralValue,
                totalCollateralRatio(collateralValue, totalDebt),
                active.size());
    }

    public OraclePriceRecord oracleRecord() {
        return oraclePriceReader.readPriceRecord(pricingProperties.getAssetAddress());
    }

    static BigDecimal totalCollateralRatio(BigDecimal collateralValue, BigDecimal totalDebt) {
        if (totalDebt.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return collateralValue.divide(totalDebt, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
