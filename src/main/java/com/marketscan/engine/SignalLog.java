package com.marketscan.engine;

import com.marketscan.domain.model.WeightedSignal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of the most recent signals across all symbols. Appending beyond the capacity
 * evicts the oldest entry. Entries are immutable and returned newest first.
 */
public class SignalLog {

    private final int capacity;
    private final Deque<WeightedSignal> entries;

    public SignalLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Signal log capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void append(WeightedSignal signal) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(signal);
    }

    /**
     * Newest signals first, optionally for one symbol only.
     *
     * @param symbol null for all symbols
     */
    public synchronized List<WeightedSignal> recent(String symbol, int limit) {
        List<WeightedSignal> result = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<WeightedSignal> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            WeightedSignal signal = it.next();
            if (symbol == null || symbol.equals(signal.getSymbol())) {
                result.add(signal);
            }
        }
        return result;
    }

    public Optional<WeightedSignal> latest(String symbol) {
        return recent(symbol, 1).stream().findFirst();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
