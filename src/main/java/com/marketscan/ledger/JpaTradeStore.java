package com.marketscan.ledger;

import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.Trade;
import com.marketscan.exception.PersistenceFailureException;
import com.marketscan.mapper.LedgerMapper;
import com.marketscan.repository.jpa.PositionJpaRepository;
import com.marketscan.repository.jpa.TradeJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TradeStore} on the trades and open_positions tables. Spring data access failures are
 * rethrown as {@link PersistenceFailureException}.
 */
@Service
public class JpaTradeStore implements TradeStore {

    private final TradeJpaRepository tradeJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final LedgerMapper ledgerMapper = Mappers.getMapper(LedgerMapper.class);

    public JpaTradeStore(TradeJpaRepository tradeJpaRepository, PositionJpaRepository positionJpaRepository) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
    }

    @Override
    @Transactional
    public void recordTrade(Trade trade) {
        try {
            tradeJpaRepository.save(ledgerMapper.toEntity(trade));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to record trade " + trade.getId(), e);
        }
    }

    @Override
    @Transactional
    public void savePosition(Position position) {
        try {
            positionJpaRepository.save(ledgerMapper.toEntity(position));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to save position " + position.getSymbol(), e);
        }
    }

    @Override
    @Transactional
    public void deletePosition(String symbol) {
        try {
            if (positionJpaRepository.existsById(symbol)) {
                positionJpaRepository.deleteById(symbol);
            }
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to delete position " + symbol, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> listOpenPositions() {
        try {
            return ledgerMapper.toPositions(positionJpaRepository.findAll());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load open positions", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> listClosedTrades() {
        try {
            return ledgerMapper.toTrades(tradeJpaRepository.findClosedTrades());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load trade history", e);
        }
    }
}
