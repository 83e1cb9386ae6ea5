package com.polymix.arb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymix.arb.core.LedgerRepository;
import com.polymix.arb.core.OutcomePairAssembler;
import com.polymix.arb.core.OutcomePairSource;
import com.polymix.arb.core.VenueClient;
import com.polymix.arb.core.VenueClientRegistry;
import com.polymix.arb.domain.ExecutionMode;
import com.polymix.arb.infra.JsonFileLedgerRepository;
import com.polymix.arb.infra.JsonFileOutcomePairSource;
import com.polymix.arb.infra.KalshiVenueClient;
import com.polymix.arb.infra.PolymarketVenueClient;
import com.polymix.arb.infra.SimulatedVenueClient;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OkHttpClient okHttpClient(TradingProperties properties) {
        return new OkHttpClient.Builder()
                .callTimeout(properties.getHttp().getCallTimeout())
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean
    public LedgerRepository ledgerRepository(TradingProperties properties, ObjectMapper objectMapper) {
        return new JsonFileLedgerRepository(Path.of(properties.getLedgerFile()), objectMapper);
    }

    @Bean
    public VenueClientRegistry venueClientRegistry(TradingProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper, Clock clock) {
        List<VenueClient> live = List.of(
                new PolymarketVenueClient(httpClient, objectMapper, properties, clock),
                new KalshiVenueClient(httpClient, objectMapper, properties, clock));
        if (properties.getMode() == ExecutionMode.LIVE) {
            log.warn("⚠️ LIVE mode: orders will be sent to {}",
                    live.stream().map(c -> c.venue().getDisplayName()).collect(Collectors.joining(", ")));
            return new VenueClientRegistry(live);
        }
        log.info("SIMULATED mode: orders fill locally, settlement is read from the venues");
        return new VenueClientRegistry(live.stream()
                .map(client -> new SimulatedVenueClient(client, clock))
                .collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnExpression("!'${arb.feed-file:}'.isBlank()")
    public OutcomePairSource fileOutcomePairSource(TradingProperties properties, ObjectMapper objectMapper,
            OutcomePairAssembler assembler) {
        return new JsonFileOutcomePairSource(Path.of(properties.getFeedFile()), objectMapper, assembler);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService legExecutor() {
        return Executors.newCachedThreadPool(named("leg-placement"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService settlementExecutor(TradingProperties properties) {
        return Executors.newFixedThreadPool(properties.getSettlement().getQueryThreads(), named("settlement-query"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
