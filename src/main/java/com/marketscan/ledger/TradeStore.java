package com.marketscan.ledger;

import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.Trade;
import java.util.List;

/**
 * Durable storage behind the {@link PositionLedger}.
 *
 * <p>Every method may throw {@link com.marketscan.exception.PersistenceFailureException}.
 */
public interface TradeStore {

    /** Inserts or updates a trade by id. */
    void recordTrade(Trade trade);

    /** Inserts or replaces the open position for its symbol. */
    void savePosition(Position position);

    void deletePosition(String symbol);

    List<Position> listOpenPositions();

    /** Executed trades that closed a position, oldest first. */
    List<Trade> listClosedTrades();
}
