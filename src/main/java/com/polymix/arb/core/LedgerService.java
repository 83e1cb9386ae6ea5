package com.polymix.arb.core;

import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.domain.Ledger;
import com.polymix.arb.domain.LedgerSummary;
import com.polymix.arb.domain.Trade;
import com.polymix.arb.domain.TradeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the in-memory ledger and its persistence. Every balance or status write goes through
 * this service under one lock, which the engine also holds for a whole size/place/commit
 * cycle.
 */
@Slf4j
@Service
public class LedgerService {

    private final LedgerRepository repository;
    private final TradingProperties properties;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Ledger ledger;

    private boolean dirty; // last write failed, memory is ahead of disk

    public LedgerService(LedgerRepository repository, TradingProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.ledger = repository.load()
                .map(this::migrate)
                .orElseGet(this::freshLedger);
        log.info("[LEDGER] Loaded: balance=${} initial=${} trades={} errors={}", ledger.getBalance(),
                ledger.getInitialBalance(), ledger.getTrades().size(), ledger.getErrors().size());
    }

    /**
     * Live reference; callers that mutate it must hold the lock via {@link #exclusive}.
     */
    public Ledger ledger() {
        return ledger;
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    public <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDirty() {
        return exclusive(() -> dirty);
    }

    /**
     * Appends a freshly placed trade, debits its cost and counts it against today's limit.
     *
     * @return true if the ledger reached disk; false means the trade is held in memory and
     *         the next successful write will carry it
     */
    public boolean commitTrade(Trade trade) {
        return exclusive(() -> {
            Instant now = clock.instant();
            ledger.rollDailyCounters(today());
            // the debit only happens once the trade is in the list
            ledger.getTrades().add(trade);
            ledger.setBalance(ledger.getBalance().subtract(trade.getCost()));
            ledger.getDailyRisk().getTrades().add(new Ledger.DailyTradeEntry(today(), trade.getId(), now));

            boolean persisted = persist();
            if (!persisted) {
                String error = "Trade placed on both venues but ledger write failed; held in memory until next write";
                ledger.recordError(trade.getId(), error, now, properties.getErrorLogCapacity());
                log.error("[LEDGER] 🚨 {} ({} cost=${})", error, trade.getId(), trade.getCost());
            }
            return persisted;
        });
    }

    /**
     * Moves a pending trade to a terminal state and credits its payout. A trade that is no
     * longer pending is left untouched, so repeated passes never pay twice.
     *
     * @return true if the trade was updated
     */
    public boolean applySettlement(Trade trade, TradeStatus terminalStatus, BigDecimal payout) {
        if (terminalStatus != TradeStatus.SETTLED && terminalStatus != TradeStatus.INCOMPLETE) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        return exclusive(() -> {
            if (trade.getStatus() != TradeStatus.PENDING) {
                return false;
            }
            BigDecimal realized = payout.subtract(trade.getCost());
            trade.setStatus(terminalStatus);
            trade.setSettledAt(clock.instant());
            trade.setSettledAmount(payout);
            trade.setRealizedProfit(realized);
            ledger.setBalance(ledger.getBalance().add(payout));

            if (realized.signum() < 0) {
                ledger.rollDailyCounters(today());
                ledger.getDailyRisk().setDailyLoss(ledger.getDailyRisk().getDailyLoss().add(realized.abs()));
            }
            persist();
            return true;
        });
    }

    public void recordError(String tradeId, String error) {
        exclusive(() -> {
            ledger.recordError(tradeId, error, clock.instant(), properties.getErrorLogCapacity());
            persist();
            return null;
        });
    }

    public LedgerSummary summary() {
        return exclusive(() -> {
            List<Trade> trades = ledger.getTrades();
            BigDecimal realized = trades.stream()
                    .filter(t -> t.getStatus() == TradeStatus.SETTLED && t.getRealizedProfit() != null)
                    .map(Trade::getRealizedProfit)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal estimated = trades.stream()
                    .filter(t -> t.getStatus() == TradeStatus.PENDING && t.getExpectedProfit() != null)
                    .map(Trade::getExpectedProfit)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            List<Trade> newestFirst = new ArrayList<>(trades);
            newestFirst.sort(Comparator.comparing(Trade::getPlacedAt,
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed());

            boolean newDay = !today().equals(ledger.getDailyRisk().getResetDate());
            return LedgerSummary.builder()
                    .balance(ledger.getBalance())
                    .initialBalance(ledger.getInitialBalance())
                    .totalProfit(realized)
                    .estimatedProfit(estimated)
                    .totalTrades(trades.size())
                    .dailyLoss(newDay ? BigDecimal.ZERO : ledger.getDailyRisk().getDailyLoss())
                    .dailyTrades(ledger.tradesOn(today()))
                    .trades(newestFirst)
                    .build();
        });
    }

    /**
     * Writes the whole ledger, retrying with a fixed backoff. Never throws.
     */
    private boolean persist() {
        int attempts = properties.getPersistAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                repository.save(ledger);
                if (dirty) {
                    log.info("[LEDGER] Pending changes flushed to disk");
                }
                dirty = false;
                return true;
            } catch (LedgerPersistenceException e) {
                log.warn("[LEDGER] Write attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                if (attempt < attempts && !sleep(properties.getPersistBackoff().toMillis())) {
                    break;
                }
            }
        }
        dirty = true;
        log.error("[LEDGER] Ledger write failed after {} attempts; in-memory state is authoritative", attempts);
        return false;
    }

    private boolean sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Ledger freshLedger() {
        Ledger fresh = Ledger.fresh(properties.getInitialBalance(), today());
        try {
            repository.save(fresh);
        } catch (LedgerPersistenceException e) {
            log.error("[LEDGER] Could not write initial ledger", e);
            dirty = true;
        }
        return fresh;
    }

    // Older documents may lack the risk counters or the error list
    private Ledger migrate(Ledger loaded) {
        if (loaded.getInitialBalance() == null) {
            loaded.setInitialBalance(Objects.requireNonNullElse(loaded.getBalance(), properties.getInitialBalance()));
        }
        if (loaded.getBalance() == null) {
            loaded.setBalance(loaded.getInitialBalance());
        }
        if (loaded.getTrades() == null) {
            loaded.setTrades(new ArrayList<>());
        }
        if (loaded.getErrors() == null) {
            loaded.setErrors(new ArrayList<>());
        }
        Ledger.DailyRisk risk = loaded.getDailyRisk();
        if (risk == null) {
            risk = new Ledger.DailyRisk();
            loaded.setDailyRisk(risk);
        }
        if (risk.getDailyLoss() == null) {
            risk.setDailyLoss(BigDecimal.ZERO);
        }
        if (risk.getTrades() == null) {
            risk.setTrades(new ArrayList<>());
        }
        if (risk.getResetDate() == null) {
            risk.setResetDate(today());
        }
        return loaded;
    }
}
