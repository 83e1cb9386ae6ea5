package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.ArbitrageOpportunity;
import com.polymix.arb.domain.Sizing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Component
@RequiredArgsConstructor
public class PositionSizer {

    static final int USD_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradingProperties properties;

    public Sizing size(ArbitrageOpportunity opportunity) {
        BigDecimal quantity = properties.getTargetUnits().multiply(opportunity.getQuality().getSizeMultiplier());

        // Every unit pays $1, so quantity is also the notional at risk
        if (quantity.compareTo(properties.getLiquidityThreshold()) > 0) {
            quantity = quantity.multiply(BigDecimal.ONE.subtract(properties.getLiquidityDiscount()));
        }
        // Kalshi only trades whole contracts and both legs must be the same size
        quantity = quantity.setScale(0, RoundingMode.DOWN);

        BigDecimal costUsd = usd(opportunity.getTotalCost().multiply(quantity));
        BigDecimal profitUsd = usd(opportunity.getEdge().multiply(quantity));
        BigDecimal roiPercent = costUsd.signum() > 0
                ? profitUsd.multiply(HUNDRED).divide(costUsd, USD_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return Sizing.builder()
                .quantity(quantity)
                .costUsd(costUsd)
                .profitUsd(profitUsd)
                .roiPercent(roiPercent)
                .build();
    }

    /**
     * Converts a cents-per-unit amount times quantity to dollars.
     */
    static BigDecimal usd(BigDecimal centsTimesQuantity) {
        return centsTimesQuantity.divide(HUNDRED, USD_SCALE, RoundingMode.HALF_UP);
    }
}
