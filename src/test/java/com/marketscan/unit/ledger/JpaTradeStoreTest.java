package com.marketscan.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketscan.domain.enums.OrderSide;
import com.marketscan.domain.enums.PositionSide;
import com.marketscan.domain.enums.TradeStatus;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.Trade;
import com.marketscan.entity.PositionEntity;
import com.marketscan.entity.TradeEntity;
import com.marketscan.exception.ErrorCode;
import com.marketscan.exception.PersistenceFailureException;
import com.marketscan.ledger.JpaTradeStore;
import com.marketscan.repository.jpa.PositionJpaRepository;
import com.marketscan.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class JpaTradeStoreTest {

    private static final LocalDateTime OPENED = LocalDateTime.of(2025, 6, 11, 10, 30);

    @Mock
    private TradeJpaRepository tradeJpaRepository;

    @Mock
    private PositionJpaRepository positionJpaRepository;

    @Captor
    private ArgumentCaptor<TradeEntity> tradeCaptor;

    @Captor
    private ArgumentCaptor<PositionEntity> positionCaptor;

    private JpaTradeStore jpaTradeStore;

    @BeforeEach
    void setUp() {
        jpaTradeStore = new JpaTradeStore(tradeJpaRepository, positionJpaRepository);
    }

    private static Position position() {
        return Position.builder()
                .symbol("HDFCBANK")
                .side(PositionSide.LONG)
                .entryPrice(new BigDecimal("1650.25"))
                .quantity(30)
                .stopLoss(new BigDecimal("1620.25"))
                .takeProfit(new BigDecimal("1710.25"))
                .trailingPeak(new BigDecimal("1655.00"))
                .openedAt(OPENED)
                .strategyId("s-macd")
                .build();
    }

    @Test
    @DisplayName("Records trades field for field")
    void recordTrade() {
        Trade trade = Trade.builder()
                .id("t-1")
                .symbol("HDFCBANK")
                .side(OrderSide.SELL)
                .quantity(30)
                .price(new BigDecimal("1700"))
                .status(TradeStatus.EXECUTED)
                .timestamp(OPENED.plusHours(2))
                .pnl(new BigDecimal("1492.50"))
                .build();

        jpaTradeStore.recordTrade(trade);

        verify(tradeJpaRepository).save(tradeCaptor.capture());
        TradeEntity saved = tradeCaptor.getValue();
        assertThat(saved.getId()).isEqualTo("t-1");
        assertThat(saved.getSide()).isEqualTo(OrderSide.SELL);
        assertThat(saved.getStatus()).isEqualTo(TradeStatus.EXECUTED);
        assertThat(saved.getPnl()).isEqualByComparingTo("1492.50");
    }

    @Test
    @DisplayName("Saves and reloads open positions")
    void positions() {
        jpaTradeStore.savePosition(position());

        verify(positionJpaRepository).save(positionCaptor.capture());
        when(positionJpaRepository.findAll()).thenReturn(List.of(positionCaptor.getValue()));

        assertThat(jpaTradeStore.listOpenPositions()).containsExactly(position());
    }

    @Test
    @DisplayName("Loads executed closing trades")
    void closedTrades() {
        TradeEntity entity = TradeEntity.builder()
                .id("t-2")
                .symbol("ITC")
                .side(OrderSide.BUY)
                .quantity(100)
                .price(new BigDecimal("430.10"))
                .status(TradeStatus.EXECUTED)
                .timestamp(OPENED)
                .pnl(new BigDecimal("-120.00"))
                .build();
        when(tradeJpaRepository.findClosedTrades()).thenReturn(List.of(entity));

        List<Trade> trades = jpaTradeStore.listClosedTrades();

        assertThat(trades).singleElement().satisfies(t -> {
            assertThat(t.isClosing()).isTrue();
            assertThat(t.getSymbol()).isEqualTo("ITC");
            assertThat(t.getPnl()).isEqualByComparingTo("-120.00");
        });
    }

    @Test
    @DisplayName("Deleting a missing position is a no-op")
    void deleteMissing() {
        when(positionJpaRepository.existsById("SBIN")).thenReturn(false);

        jpaTradeStore.deletePosition("SBIN");

        verify(positionJpaRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("Data access failures surface as persistence failures")
    void wrapsDataAccessErrors() {
        when(tradeJpaRepository.save(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));
        Trade trade = Trade.builder().id("t-3").symbol("SBIN").status(TradeStatus.PENDING).build();

        assertThatThrownBy(() -> jpaTradeStore.recordTrade(trade))
                .isInstanceOf(PersistenceFailureException.class)
                .hasMessageContaining("t-3")
                .satisfies(e -> assertThat(((PersistenceFailureException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PERSISTENCE_FAILURE))
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
