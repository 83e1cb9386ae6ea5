package com.polymix.arb.core;

import com.polymix.arb.domain.ArbQuality;
import com.polymix.arb.domain.ArbitrageOpportunity;
import com.polymix.arb.domain.DetectionResult;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.OutcomeSide;
import com.polymix.arb.domain.RejectionReason;
import com.polymix.arb.domain.VenueQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpportunityDetector {

    private static final BigDecimal PAYOUT = BigDecimal.valueOf(100);
    private static final BigDecimal NEAR_ARB_CEILING = BigDecimal.valueOf(105);
    private static final BigDecimal PARTIAL_DIVERGENCE = BigDecimal.valueOf(3);

    private final FeeSchedule feeSchedule;
    private final Clock clock;

    /**
     * Picks the cheaper venue for each outcome independently. A hedge exists only when the
     * two outcomes land on different venues.
     */
    public DetectionResult detect(OutcomePair pair) {
        ArbitrageOpportunity.LegQuote away = cheapestLeg(pair, OutcomeSide.AWAY);
        ArbitrageOpportunity.LegQuote home = cheapestLeg(pair, OutcomeSide.HOME);

        if (away.getRawPrice().signum() <= 0 || home.getRawPrice().signum() <= 0) {
            return DetectionResult.rejected(RejectionReason.ZERO_PRICE,
                    String.format("Invalid odds (zero price): away=%s home=%s", away.getRawPrice(), home.getRawPrice()));
        }
        if (away.getVenue() == home.getVenue()) {
            return DetectionResult.rejected(RejectionReason.SAME_VENUE,
                    "Both legs cheapest on " + away.getVenue().getDisplayName());
        }

        BigDecimal grossCost = away.getRawPrice().add(home.getRawPrice());
        BigDecimal totalCost = away.getEffectivePrice().add(home.getEffectivePrice());
        ArbQuality quality = classify(pair, totalCost);
        if (quality == null) {
            return DetectionResult.rejected(RejectionReason.NO_EDGE,
                    "Total effective cost " + totalCost + " leaves no edge");
        }

        ArbitrageOpportunity opportunity = ArbitrageOpportunity.builder()
                .pair(pair)
                .away(away)
                .home(home)
                .grossCost(grossCost)
                .totalCost(totalCost)
                .edge(PAYOUT.subtract(totalCost))
                .quality(quality)
                .detectedAt(Instant.now(clock))
                .build();

        log.info("📈 {} ARB FOUND: {} | away {}@{} home {}@{} | Cost: {} Edge: {}",
                quality, pair.id(), away.getVenue().getDisplayName(), away.getRawPrice(),
                home.getVenue().getDisplayName(), home.getRawPrice(), totalCost, opportunity.getEdge());
        return DetectionResult.found(opportunity);
    }

    private ArbitrageOpportunity.LegQuote cheapestLeg(OutcomePair pair, OutcomeSide side) {
        ArbitrageOpportunity.LegQuote first = legQuote(pair.getFirst(), side);
        ArbitrageOpportunity.LegQuote second = legQuote(pair.getSecond(), side);
        // strictly cheaper wins, ties go to the second quote
        return first.getEffectivePrice().compareTo(second.getEffectivePrice()) < 0 ? first : second;
    }

    private ArbitrageOpportunity.LegQuote legQuote(VenueQuote quote, OutcomeSide side) {
        BigDecimal raw = quote.priceFor(side);
        return ArbitrageOpportunity.LegQuote.builder()
                .side(side)
                .venue(quote.getVenue())
                .rawPrice(raw)
                .effectivePrice(feeSchedule.effectivePrice(quote.getVenue(), raw))
                .feeRate(feeSchedule.feeRate(quote.getVenue()))
                .slippage(feeSchedule.slippage(quote.getVenue()))
                .marketId(quote.marketIdFor(side))
                .url(quote.getUrl())
                .build();
    }

    private ArbQuality classify(OutcomePair pair, BigDecimal totalCost) {
        if (totalCost.compareTo(PAYOUT) < 0) {
            return ArbQuality.PERFECT;
        }
        if (totalCost.compareTo(NEAR_ARB_CEILING) <= 0) {
            return ArbQuality.NEAR;
        }
        if (divergence(pair, OutcomeSide.AWAY).compareTo(PARTIAL_DIVERGENCE) > 0
                || divergence(pair, OutcomeSide.HOME).compareTo(PARTIAL_DIVERGENCE) > 0) {
            return ArbQuality.PARTIAL;
        }
        return null;
    }

    private BigDecimal divergence(OutcomePair pair, OutcomeSide side) {
        return pair.getFirst().priceFor(side).subtract(pair.getSecond().priceFor(side)).abs();
    }
}
