package com.marketscan.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marketscan.api.controller.BacktestController;
import com.marketscan.api.dto.request.BacktestRequest;
import com.marketscan.backtest.BacktestResult;
import com.marketscan.backtest.BacktestService;
import com.marketscan.config.ApiResponseAdvice;
import com.marketscan.exception.GlobalExceptionHandler;
import com.marketscan.strategy.VoterKind;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BacktestControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BacktestService backtestService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BacktestController(backtestService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/backtest runs the replay with request defaults")
    void run() throws Exception {
        when(backtestService.run(any())).thenReturn(new BacktestResult(
                "INFY",
                VoterKind.RSI,
                500,
                4,
                3,
                1,
                new BigDecimal("75.00"),
                new BigDecimal("1250.00"),
                new BigDecimal("101250.00"),
                new BigDecimal("0.80"),
                new BigDecimal("2.10"),
                new BigDecimal("4.00"),
                false,
                List.of()));

        mockMvc.perform(post("/api/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "symbol": "INFY", "voterKind": "RSI", "params": { "period": 10 } }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.voterKind").value("RSI"))
                .andExpect(jsonPath("$.data.totalTrades").value(4))
                .andExpect(jsonPath("$.data.totalPnl").value(1250.0));

        verify(backtestService).run(argThat((BacktestRequest r) -> r.getBars() == 500
                && r.getInitialCapital().compareTo(new BigDecimal("100000")) == 0
                && Integer.valueOf(10).equals(r.getParams().get("period"))));
    }

    @Test
    @DisplayName("Missing symbol and too few bars are validation errors")
    void validation() throws Exception {
        mockMvc.perform(post("/api/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "voterKind": "MACD", "bars": 20 }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.symbol").value("Symbol is required"))
                .andExpect(jsonPath("$.error.details.bars").value("At least 60 bars are needed"));

        verify(backtestService, never()).run(any());
    }

    @Test
    @DisplayName("An unknown voter kind names the offending field")
    void unknownVoter() throws Exception {
        mockMvc.perform(post("/api/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "symbol": "INFY", "voterKind": "ICHIMOKU" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Invalid value for field voterKind"))
                .andExpect(jsonPath("$.error.details.voterKind").value("ICHIMOKU"));
    }

    @Test
    @DisplayName("Unparseable JSON is a malformed body")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"symbol\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.message").value("Malformed request body"));
    }
}
