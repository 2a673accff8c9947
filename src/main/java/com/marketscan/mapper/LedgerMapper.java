package com.marketscan.mapper;

import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.Trade;
import com.marketscan.entity.PositionEntity;
import com.marketscan.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * Ledger rows to and from the immutable domain models. Column names match field names, so
 * nothing needs an explicit mapping; the domain side is built through its Lombok builders.
 */
@Mapper
public interface LedgerMapper {

    TradeEntity toEntity(Trade trade);

    PositionEntity toEntity(Position position);

    Trade toTrade(TradeEntity entity);

    Position toPosition(PositionEntity entity);

    List<Trade> toTrades(List<TradeEntity> entities);

    List<Position> toPositions(List<PositionEntity> entities);
}
