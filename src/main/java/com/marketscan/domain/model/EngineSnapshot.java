package com.marketscan.domain.model;

import com.marketscan.domain.enums.EngineMode;
import com.marketscan.domain.enums.EngineState;
import com.marketscan.strategy.VoterKind;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the engine for the status endpoint. Replaced wholesale after every
 * tick and on every start/stop; readers never see a half-updated snapshot.
 */
@Value
@Builder(toBuilder = true)
public class EngineSnapshot {

    boolean running;
    EngineState state;
    EngineMode mode;
    String userId;

    /** Ticks that scanned symbols since the last start. */
    long scanCount;

    BigDecimal capital;
    BigDecimal dailyPnl;
    int tradesToday;
    int openPositions;
    LocalDateTime lastScanAt;
    boolean marketOpen;

    List<VoterKind> activeVoters;
    List<String> symbols;
    int signalsInMemory;

    /** Most recent failure per symbol; cleared when the symbol scans cleanly. */
    Map<String, String> lastErrors;
}
