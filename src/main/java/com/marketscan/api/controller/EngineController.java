package com.marketscan.api.controller;

import com.marketscan.api.dto.request.EngineStartRequest;
import com.marketscan.domain.model.EngineSnapshot;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.RiskMetrics;
import com.marketscan.domain.model.WeightedSignal;
import com.marketscan.engine.ScanEngine;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status and control of the scan engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/engine/status -- current engine snapshot</li>
 *   <li>POST /api/engine/start -- start scanning, optionally for a user</li>
 *   <li>POST /api/engine/stop -- stop after the tick in progress</li>
 *   <li>GET /api/engine/signals -- recent signals, newest first, optionally for one symbol</li>
 *   <li>GET /api/engine/signals/{symbol} -- fresh signal for a symbol, not traded</li>
 *   <li>GET /api/engine/metrics -- capital, daily P&L and performance ratios</li>
 *   <li>GET /api/engine/positions -- open paper positions</li>
 *   <li>GET /api/engine/symbols -- the scan universe</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine")
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private static final int MAX_SIGNALS = 500;

    private final ScanEngine scanEngine;

    public EngineController(ScanEngine scanEngine) {
        this.scanEngine = scanEngine;
    }

    @GetMapping("/status")
    public ResponseEntity<EngineSnapshot> getStatus() {
        return ResponseEntity.ok(scanEngine.getSnapshot());
    }

    @PostMapping("/start")
    public ResponseEntity<EngineSnapshot> start(@RequestBody(required = false) EngineStartRequest request) {
        String userId = request != null ? request.getUserId() : null;
        log.info("Start requested for user {}", userId);
        return ResponseEntity.ok(scanEngine.start(userId));
    }

    @PostMapping("/stop")
    public ResponseEntity<EngineSnapshot> stop() {
        log.info("Stop requested");
        return ResponseEntity.ok(scanEngine.stop());
    }

    @GetMapping("/signals")
    public ResponseEntity<List<WeightedSignal>> getSignals(
            @RequestParam(required = false) String symbol, @RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_SIGNALS));
        return ResponseEntity.ok(scanEngine.getSignals(symbol, bounded));
    }

    @GetMapping("/signals/{symbol}")
    public ResponseEntity<WeightedSignal> getCurrentSignal(@PathVariable String symbol) {
        return ResponseEntity.ok(scanEngine.currentSignal(symbol.toUpperCase()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<RiskMetrics> getMetrics() {
        return ResponseEntity.ok(scanEngine.getRiskMetrics());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> getPositions() {
        return ResponseEntity.ok(scanEngine.getOpenPositions());
    }

    @GetMapping("/symbols")
    public ResponseEntity<List<String>> getSymbols() {
        return ResponseEntity.ok(scanEngine.getSymbols());
    }
}
