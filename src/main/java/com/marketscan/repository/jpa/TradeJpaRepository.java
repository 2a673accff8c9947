package com.marketscan.repository.jpa;

import com.marketscan.domain.enums.TradeStatus;
import com.marketscan.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    @Query("SELECT t FROM TradeEntity t WHERE t.pnl IS NOT NULL AND t.status = :status ORDER BY t.timestamp ASC")
    List<TradeEntity> findClosingTradesByStatus(@Param("status") TradeStatus status);

    default List<TradeEntity> findClosedTrades() {
        return findClosingTradesByStatus(TradeStatus.EXECUTED);
    }
}
