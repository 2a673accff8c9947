package com.marketscan.api.controller;

import com.marketscan.api.dto.request.BacktestRequest;
import com.marketscan.backtest.BacktestResult;
import com.marketscan.backtest.BacktestService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /api/backtest -- replay one voter over simulated history. */
@RestController
@RequestMapping("/api/backtest")
public class BacktestController {

    private final BacktestService backtestService;

    public BacktestController(BacktestService backtestService) {
        this.backtestService = backtestService;
    }

    @PostMapping
    public ResponseEntity<BacktestResult> run(@Valid @RequestBody BacktestRequest request) {
        return ResponseEntity.ok(backtestService.run(request));
    }
}
