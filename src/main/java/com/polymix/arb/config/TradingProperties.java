package com.polymix.arb.config;

import com.polymix.arb.domain.ExecutionMode;
import com.polymix.arb.domain.Venue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "arb")
public class TradingProperties {

    @NotNull
    private ExecutionMode mode = ExecutionMode.SIMULATED;

    @NotBlank
    private String ledgerFile = "data/ledger.json";

    // Matched-games snapshot written by the market-data fetchers; blank disables the file feed
    private String feedFile = "";

    // Sizing
    @NotNull @PositiveOrZero
    private BigDecimal initialBalance = new BigDecimal("10000");
    @NotNull @Positive
    private BigDecimal targetUnits = new BigDecimal("100");
    @NotNull
    private BigDecimal liquidityThreshold = new BigDecimal("200");
    @NotNull @PositiveOrZero @DecimalMax("1")
    private BigDecimal liquidityDiscount = new BigDecimal("0.01");

    // Risk limits
    @NotNull
    private BigDecimal minRoiPercent = BigDecimal.ZERO;
    @NotNull @PositiveOrZero
    private BigDecimal dailyLossLimit = new BigDecimal("500");
    @NotNull @PositiveOrZero
    private BigDecimal maxPositionSize = new BigDecimal("1000");
    @Min(0)
    private int maxDailyTrades = 10;

    // Execution
    @NotNull
    private Duration legTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration settlementTimeout = Duration.ofHours(24);
    @Min(1)
    private int persistAttempts = 3;
    @NotNull
    private Duration persistBackoff = Duration.ofMillis(200);
    @Min(1)
    private int errorLogCapacity = 100;

    @Valid
    private Map<Venue, VenueFees> fees = defaultFees();

    @Valid
    private Engine engine = new Engine();
    @Valid
    private Settlement settlement = new Settlement();
    @Valid
    private Http http = new Http();
    @Valid
    private Polymarket polymarket = new Polymarket();
    @Valid
    private Kalshi kalshi = new Kalshi();

    private static Map<Venue, VenueFees> defaultFees() {
        Map<Venue, VenueFees> fees = new EnumMap<>(Venue.class);
        fees.put(Venue.POLYMARKET, new VenueFees(new BigDecimal("0.02"), new BigDecimal("0.005")));
        fees.put(Venue.KALSHI, new VenueFees(new BigDecimal("0.07"), new BigDecimal("0.005")));
        return fees;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VenueFees {
        @NotNull @PositiveOrZero
        private BigDecimal feeRate;
        @NotNull @PositiveOrZero
        private BigDecimal slippage;
    }

    @Data
    public static class Engine {
        private boolean enabled = true;
        @Min(100)
        private long loopIntervalMillis = 5000;
    }

    @Data
    public static class Settlement {
        private boolean enabled = true;
        @Min(1000)
        private long pollIntervalMillis = 60000;
        @Min(1)
        private int queryThreads = 4;
    }

    @Data
    public static class Http {
        @Positive
        private double requestsPerSecond = 4.0;
        @Min(1)
        private int burst = 2;
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(500);
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Polymarket {
        private String privateKey = "";
        private long chainId = 137;
        @NotBlank
        private String clobUrl = "https://clob.polymarket.com";
        @NotBlank
        private String gammaUrl = "https://gamma-api.polymarket.com";
    }

    @Data
    public static class Kalshi {
        private String apiKeyId = "";
        private String privateKey = ""; // PEM text, literal \n allowed
        private String privateKeyPath = "";
        @NotBlank
        private String baseUrl = "https://api.elections.kalshi.com/trade-api/v2";
    }
}
