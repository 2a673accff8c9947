package com.marketscan.marketdata;

import com.marketscan.domain.enums.EngineMode;
import com.marketscan.timeseries.Candle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Random-walk candle generator used when no broker session is available.
 *
 * <p>Each symbol gets its own {@link Random} seeded from the symbol name, so a symbol always
 * starts from the same price ({@code basePrice + |hash| % priceSpread}) and replays the same
 * walk. The walk is bounded to a band around the starting price.
 *
 * <p>Bars are aligned to the candle interval. When the clock crosses into a new interval the
 * missing bars are appended; between boundaries every fetch moves the forming (last) bar by
 * one random step, the way a live bar keeps changing until it closes.
 */
@Component
public class SimulatedMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataSource.class);

    private final MarketDataProperties properties;
    private final Clock clock;
    private final Map<String, SymbolWalk> walks = new ConcurrentHashMap<>();

    public SimulatedMarketDataSource(MarketDataProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<Candle> fetchCandles(String symbol, int count) {
        int capacity = Math.max(count, properties.getSimulation().getHistorySize());
        SymbolWalk walk = walks.computeIfAbsent(symbol, s -> new SymbolWalk(s, capacity));
        synchronized (walk) {
            walk.advanceTo(LocalDateTime.now(clock));
            return walk.latest(count);
        }
    }

    @Override
    public EngineMode getMode() {
        return EngineMode.SIMULATION;
    }

    /** Starting price of the walk for {@code symbol}. */
    public BigDecimal startingPrice(String symbol) {
        MarketDataProperties.Simulation sim = properties.getSimulation();
        double base = sim.getBasePrice() + Math.floorMod(symbol.hashCode(), sim.getPriceSpread());
        return BigDecimal.valueOf(base).setScale(2, RoundingMode.HALF_UP);
    }

    private final class SymbolWalk {

        private final String symbol;
        private final Random random;
        private final Duration interval;
        private final Deque<Candle> bars = new ArrayDeque<>();
        private final int capacity;
        private final double start;
        private final double floor;
        private final double ceiling;

        private SymbolWalk(String symbol, int capacity) {
            MarketDataProperties.Simulation sim = properties.getSimulation();
            this.symbol = symbol;
            this.random = new Random(symbol.hashCode());
            this.interval = properties.getInterval().getDuration();
            this.capacity = capacity;
            this.start = startingPrice(symbol).doubleValue();
            this.floor = start * (1 - sim.getBand());
            this.ceiling = start * (1 + sim.getBand());
            seed(LocalDateTime.now(clock));
        }

        private void seed(LocalDateTime now) {
            LocalDateTime last = alignDown(now);
            LocalDateTime first = last.minus(interval.multipliedBy(capacity - 1L));
            double close = start;
            for (int i = 0; i < capacity; i++) {
                Candle bar = nextBar(first.plus(interval.multipliedBy(i)), close);
                append(bar);
                close = bar.getClose().doubleValue();
            }
            log.debug("Seeded {} simulated bars for {} starting at {}", capacity, symbol, start);
        }

        private void advanceTo(LocalDateTime now) {
            LocalDateTime target = alignDown(now);
            LocalDateTime lastTs = bars.getLast().getTimestamp();
            if (!target.isAfter(lastTs)) {
                tickFormingBar();
                return;
            }
            long missing = Duration.between(lastTs, target).dividedBy(interval);
            // Gaps longer than the buffer are refilled from the latest boundary backwards
            long skip = Math.max(0, missing - capacity);
            LocalDateTime next = lastTs.plus(interval.multipliedBy(skip + 1));
            while (!next.isAfter(target)) {
                append(nextBar(next, bars.getLast().getClose().doubleValue()));
                next = next.plus(interval);
            }
        }

        private List<Candle> latest(int count) {
            List<Candle> all = new ArrayList<>(bars);
            return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
        }

        private Candle nextBar(LocalDateTime timestamp, double previousClose) {
            double volatility = properties.getSimulation().getVolatility();
            double close = bound(previousClose * (1 + random.nextGaussian() * volatility));
            double open = close * (1 + (random.nextDouble() - 0.5) * 0.01);
            double high = Math.max(open, close) * (1 + random.nextDouble() * 0.01);
            double low = Math.min(open, close) * (1 - random.nextDouble() * 0.01);
            long volume = 1000 + random.nextInt(99_001);
            return Candle.builder()
                    .symbol(symbol)
                    .timestamp(timestamp)
                    .open(price(open))
                    .high(price(high))
                    .low(price(low))
                    .close(price(close))
                    .volume(volume)
                    .build();
        }

        private void tickFormingBar() {
            Candle forming = bars.removeLast();
            double volatility = properties.getSimulation().getVolatility();
            BigDecimal close = price(bound(forming.getClose().doubleValue() * (1 + random.nextGaussian() * volatility)));
            bars.addLast(Candle.builder()
                    .symbol(symbol)
                    .timestamp(forming.getTimestamp())
                    .open(forming.getOpen())
                    .high(forming.getHigh().max(close))
                    .low(forming.getLow().min(close))
                    .close(close)
                    .volume(forming.getVolume() + random.nextInt(1000))
                    .build());
        }

        private void append(Candle bar) {
            bars.addLast(bar);
            while (bars.size() > capacity) {
                bars.removeFirst();
            }
        }

        private double bound(double value) {
            return Math.min(ceiling, Math.max(floor, value));
        }

        private LocalDateTime alignDown(LocalDateTime time) {
            long minutes = interval.toMinutes();
            LocalDateTime truncated = time.truncatedTo(ChronoUnit.MINUTES);
            return truncated.minusMinutes(truncated.getMinute() % minutes);
        }
    }

    private static BigDecimal price(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
