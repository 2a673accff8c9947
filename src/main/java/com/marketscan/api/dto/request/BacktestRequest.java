package com.marketscan.api.dto.request;

import com.marketscan.strategy.VoterKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/backtest: replay one voter over simulated history for a symbol.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Voter kind is required")
    private VoterKind voterKind;

    /** Voter parameter overrides, same keys as the strategy store. */
    @Builder.Default
    private Map<String, Object> params = new HashMap<>();

    @Min(value = 60, message = "At least 60 bars are needed")
    @Max(value = 5000, message = "At most 5000 bars")
    @Builder.Default
    private int bars = 500;

    @DecimalMin(value = "1000", message = "Initial capital must be at least 1000")
    @Builder.Default
    private BigDecimal initialCapital = new BigDecimal("100000");
}
