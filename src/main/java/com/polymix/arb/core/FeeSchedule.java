package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.Venue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Static per-venue cost parameters. Effective price = raw x (1 + fee rate + slippage).
 */
@Component
@RequiredArgsConstructor
public class FeeSchedule {

    private final TradingProperties properties;

    public BigDecimal feeRate(Venue venue) {
        return fees(venue).getFeeRate();
    }

    public BigDecimal slippage(Venue venue) {
        return fees(venue).getSlippage();
    }

    public BigDecimal effectivePrice(Venue venue, BigDecimal rawPrice) {
        TradingProperties.VenueFees fees = fees(venue);
        return rawPrice.multiply(BigDecimal.ONE.add(fees.getFeeRate()).add(fees.getSlippage()));
    }

    private TradingProperties.VenueFees fees(Venue venue) {
        TradingProperties.VenueFees fees = properties.getFees().get(venue);
        if (fees == null) {
            throw new IllegalStateException("No fee schedule configured for " + venue);
        }
        return fees;
    }
}
