package com.polymix.arb.core;

import com.polymix.arb.domain.NormalizedProbabilities;
import com.polymix.arb.domain.OutcomePair;
import com.polymix.arb.domain.VenueQuote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Scales a two-way quote to integer probabilities that sum to exactly 100.
 */
@Component
public class ProbabilityNormalizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Floors both scaled values and gives the whole remainder to the side with the smaller
     * raw value (away on a tie).
     */
    public NormalizedProbabilities normalize(BigDecimal away, BigDecimal home) {
        if (away.signum() < 0 || home.signum() < 0) {
            throw new IllegalArgumentException("Probabilities must be non-negative: " + away + ", " + home);
        }
        BigDecimal total = away.add(home);
        if (total.signum() == 0) {
            return new NormalizedProbabilities(0, 0);
        }

        int awayFloor = floorShare(away, total);
        int homeFloor = floorShare(home, total);
        int remainder = 100 - (awayFloor + homeFloor);

        if (away.compareTo(home) <= 0) {
            return new NormalizedProbabilities(awayFloor + remainder, homeFloor);
        }
        return new NormalizedProbabilities(awayFloor, homeFloor + remainder);
    }

    /**
     * Empty for three-outcome markets: forcing the two named outcomes to 100 would hide the
     * draw's probability mass.
     */
    public Optional<NormalizedProbabilities> normalize(OutcomePair pair, VenueQuote quote) {
        if (pair.isThreeWay()) {
            return Optional.empty();
        }
        return Optional.of(normalize(quote.getAwayPrice(), quote.getHomePrice()));
    }

    private int floorShare(BigDecimal value, BigDecimal total) {
        return value.multiply(HUNDRED)
                .divide(total, 12, RoundingMode.DOWN)
                .setScale(0, RoundingMode.FLOOR)
                .intValueExact();
    }
}
