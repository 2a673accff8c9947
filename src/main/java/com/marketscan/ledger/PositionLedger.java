package com.marketscan.ledger;

import com.marketscan.domain.enums.PositionSide;
import com.marketscan.domain.enums.TradeStatus;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.Trade;
import com.marketscan.exception.NoOpenPositionException;
import com.marketscan.exception.PositionAlreadyOpenException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Open paper positions and the trade history, with write-through to a {@link TradeStore}.
 *
 * <p><b>Invariants:</b>
 * <ul>
 *   <li>At most one open position per symbol; a second open fails with
 *       {@link PositionAlreadyOpenException}</li>
 *   <li>Closing without an open position fails with {@link NoOpenPositionException}</li>
 *   <li>Every open and close appends a trade; closing trades carry
 *       {@code pnl = (exit - entry) * quantity * sign}</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> mutations on one symbol are serialised by a per-symbol
 * {@link ReentrantLock}; different symbols proceed in parallel. Each mutation is applied to
 * memory atomically before the store is written.
 *
 * <p><b>Persistence failures</b> never undo an in-memory mutation. The failed write is queued
 * and retried by {@link #retryPendingWrites()}; once {@code maxWriteAttempts} attempts have
 * failed the write is dropped and, for trade writes, the trade is marked
 * {@link TradeStatus#FAILED}.
 *
 * <p>Position writes do not replay a snapshot. Each one syncs the symbol's stored row with
 * whatever memory holds when it runs (save when open, delete when closed), and at most one is
 * pending per symbol, so a retry can never resurrect a closed position or roll back a peak.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final TradeStore tradeStore;
    private final Clock clock;
    private final int maxWriteAttempts;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    /** Insertion-ordered trade history keyed by trade id. Guarded by its own monitor. */
    private final Map<String, Trade> trades = new LinkedHashMap<>();

    private final Queue<PendingWrite> pendingWrites = new ConcurrentLinkedQueue<>();
    private final Map<String, PendingWrite> pendingPositionWrites = new ConcurrentHashMap<>();

    public PositionLedger(
            TradeStore tradeStore, Clock clock, @Value("${marketscan.ledger.max-write-attempts:3}") int maxWriteAttempts) {
        this.tradeStore = tradeStore;
        this.clock = clock;
        this.maxWriteAttempts = maxWriteAttempts;
    }

    // ==================== Mutations ====================

    /**
     * Opens a position and appends its opening trade.
     *
     * @throws PositionAlreadyOpenException if the symbol already has an open position
     */
    public Position openPosition(
            String symbol,
            PositionSide side,
            BigDecimal entryPrice,
            int quantity,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            String strategyId) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        return withSymbolLock(symbol, () -> {
            if (positions.containsKey(symbol)) {
                throw new PositionAlreadyOpenException(symbol);
            }
            LocalDateTime now = LocalDateTime.now(clock);
            Position position = Position.builder()
                    .symbol(symbol)
                    .side(side)
                    .entryPrice(entryPrice)
                    .quantity(quantity)
                    .stopLoss(stopLoss)
                    .takeProfit(takeProfit)
                    .trailingPeak(entryPrice)
                    .openedAt(now)
                    .strategyId(strategyId)
                    .build();

            Trade pending = Trade.builder()
                    .id(UUID.randomUUID().toString())
                    .symbol(symbol)
                    .side(side.entrySide())
                    .quantity(quantity)
                    .price(entryPrice)
                    .status(TradeStatus.PENDING)
                    .timestamp(now)
                    .strategyId(strategyId)
                    .build();
            // Paper fills execute immediately at the scan price
            Trade executed = pending.withStatus(TradeStatus.EXECUTED);

            positions.put(symbol, position);
            putTrade(executed);
            log.info("Opened {} {} x {} @ {} (SL {}, TP {})", side, quantity, symbol, entryPrice, stopLoss, takeProfit);

            syncPosition(symbol);
            writeThrough("record trade " + executed.getId(), executed.getId(), () -> tradeStore.recordTrade(executed));
            return position;
        });
    }

    /**
     * Closes the open position at {@code exitPrice} and appends the closing trade.
     *
     * @return the closing trade, carrying the realised P&L
     * @throws NoOpenPositionException if the symbol has no open position
     */
    public Trade closePosition(String symbol, BigDecimal exitPrice) {
        return withSymbolLock(symbol, () -> {
            Position position = positions.get(symbol);
            if (position == null) {
                throw new NoOpenPositionException(symbol);
            }
            BigDecimal pnl = position.unrealizedPnl(exitPrice).setScale(2, RoundingMode.HALF_UP);
            Trade closing = Trade.builder()
                    .id(UUID.randomUUID().toString())
                    .symbol(symbol)
                    .side(position.getSide().exitSide())
                    .quantity(position.getQuantity())
                    .price(exitPrice)
                    .status(TradeStatus.EXECUTED)
                    .timestamp(LocalDateTime.now(clock))
                    .strategyId(position.getStrategyId())
                    .pnl(pnl)
                    .build();

            positions.remove(symbol);
            putTrade(closing);
            log.info("Closed {} {} x {} @ {}, P&L {}", position.getSide(), position.getQuantity(), symbol, exitPrice, pnl);

            syncPosition(symbol);
            writeThrough("record trade " + closing.getId(), closing.getId(), () -> tradeStore.recordTrade(closing));
            return closing;
        });
    }

    /**
     * Stores the trailing peak carried by {@code tracked} on the open position.
     *
     * @throws NoOpenPositionException if the symbol has no open position
     */
    public Position updateTrailingPeak(Position tracked) {
        String symbol = tracked.getSymbol();
        return withSymbolLock(symbol, () -> {
            Position current = positions.get(symbol);
            if (current == null) {
                throw new NoOpenPositionException(symbol);
            }
            if (tracked.getTrailingPeak() == null
                    || tracked.getTrailingPeak().compareTo(current.getTrailingPeak()) == 0) {
                return current;
            }
            Position updated = current.withTrailingPeak(tracked.getTrailingPeak());
            positions.put(symbol, updated);
            syncPosition(symbol);
            return updated;
        });
    }

    // ==================== Recovery ====================

    /**
     * Loads open positions and closed-trade history from the store, keeping anything already
     * in memory. A store failure is logged and leaves the ledger as it was.
     *
     * @return number of positions restored
     */
    public int restore() {
        int restored = 0;
        try {
            for (Position position : tradeStore.listOpenPositions()) {
                if (positions.putIfAbsent(position.getSymbol(), position) == null) {
                    restored++;
                }
            }
            for (Trade trade : tradeStore.listClosedTrades()) {
                synchronized (trades) {
                    trades.putIfAbsent(trade.getId(), trade);
                }
            }
        } catch (RuntimeException e) {
            log.error("Could not restore ledger from trade store: {}", e.getMessage(), e);
        }
        if (restored > 0) {
            log.info("Restored {} open positions from trade store", restored);
        }
        return restored;
    }

    /**
     * Retries queued writes once each.
     *
     * @return number of writes still pending
     */
    public int retryPendingWrites() {
        for (String symbol : List.copyOf(pendingPositionWrites.keySet())) {
            withSymbolLock(symbol, () -> {
                PendingWrite write = pendingPositionWrites.remove(symbol);
                if (write != null) {
                    attempt(write);
                }
                return null;
            });
        }
        int batch = pendingWrites.size();
        for (int i = 0; i < batch; i++) {
            PendingWrite write = pendingWrites.poll();
            if (write == null) {
                break;
            }
            attempt(write);
        }
        return getPendingWriteCount();
    }

    // ==================== Queries ====================

    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public boolean hasOpenPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    public List<Position> getOpenPositions() {
        return List.copyOf(positions.values());
    }

    public int getOpenPositionCount() {
        return positions.size();
    }

    /** Cost basis of all open positions. */
    public BigDecimal getCommittedCapital() {
        return positions.values().stream()
                .map(p -> p.getEntryPrice().multiply(BigDecimal.valueOf(p.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<Trade> getTrades() {
        synchronized (trades) {
            return Collections.unmodifiableList(new ArrayList<>(trades.values()));
        }
    }

    /** Executed closing trades, oldest first. */
    public List<Trade> getClosingTrades() {
        return getTrades().stream()
                .filter(t -> t.isClosing() && t.getStatus() == TradeStatus.EXECUTED)
                .toList();
    }

    public List<BigDecimal> getClosedTradePnls() {
        return getClosingTrades().stream().map(Trade::getPnl).toList();
    }

    public int getPendingWriteCount() {
        return pendingWrites.size() + pendingPositionWrites.size();
    }

    // ==================== Internals ====================

    private <T> T withSymbolLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = symbolLocks.computeIfAbsent(symbol, s -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void putTrade(Trade trade) {
        synchronized (trades) {
            trades.put(trade.getId(), trade);
        }
    }

    private void writeThrough(String description, String tradeId, Runnable write) {
        attempt(new PendingWrite(description, tradeId, null, write));
    }

    /** Called with the symbol lock held. Supersedes any write still pending for the symbol. */
    private void syncPosition(String symbol) {
        pendingPositionWrites.remove(symbol);
        attempt(new PendingWrite("sync position " + symbol, null, symbol, () -> writeStoredPosition(symbol)));
    }

    private void writeStoredPosition(String symbol) {
        Position current = positions.get(symbol);
        if (current != null) {
            tradeStore.savePosition(current);
        } else {
            tradeStore.deletePosition(symbol);
        }
    }

    private void attempt(PendingWrite write) {
        write.attempts++;
        try {
            write.action.run();
            if (write.attempts > 1) {
                log.info("Write succeeded on attempt {}: {}", write.attempts, write.description);
            }
        } catch (RuntimeException e) {
            if (write.attempts >= maxWriteAttempts) {
                log.error("Giving up after {} attempts: {}", write.attempts, write.description, e);
                if (write.tradeId != null) {
                    markTradeFailed(write.tradeId);
                }
            } else {
                log.warn("Write failed (attempt {}), will retry: {}: {}", write.attempts, write.description, e.getMessage());
                if (write.symbol != null) {
                    pendingPositionWrites.put(write.symbol, write);
                } else {
                    pendingWrites.add(write);
                }
            }
        }
    }

    private void markTradeFailed(String tradeId) {
        synchronized (trades) {
            Trade trade = trades.get(tradeId);
            if (trade != null) {
                trades.put(tradeId, trade.withStatus(TradeStatus.FAILED));
            }
        }
    }

    private static final class PendingWrite {

        private final String description;
        private final String tradeId;
        private final String symbol;
        private final Runnable action;
        private int attempts;

        private PendingWrite(String description, String tradeId, String symbol, Runnable action) {
            this.description = description;
            this.tradeId = tradeId;
            this.symbol = symbol;
            this.action = action;
        }
    }
}
