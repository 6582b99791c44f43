package com.eventbacktest.backtester.controller;

import com.eventbacktest.backtester.controller.dto.BacktestRunRequest;
import com.eventbacktest.backtester.controller.dto.BacktestRunResponse;
import com.eventbacktest.backtester.domain.RunStatus;
import com.eventbacktest.backtester.service.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for backtest runs.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;

    /**
     * Run a backtest synchronously.
     *
     * @param request the run request
     * @return the completed run with statistics
     */
    @PostMapping
    public ResponseEntity<BacktestRunResponse> runBacktest(@Valid @RequestBody BacktestRunRequest request) {

        log.info("POST /backtests - Strategy: {}, Symbols: {}",
                request.getStrategyName(), request.getSymbols());

        BacktestRunResponse response = backtestService.runBacktest(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Get a run with its equity curve.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<BacktestRunResponse> getRun(@PathVariable Long runId) {

        log.info("GET /backtests/{}", runId);

        return ResponseEntity.ok(backtestService.getRun(runId));
    }

    @GetMapping
    public ResponseEntity<List<BacktestRunResponse>> getRunsByStatus(
            @RequestParam(defaultValue = "COMPLETED") RunStatus status) {

        log.info("GET /backtests?status={}", status);

        return ResponseEntity.ok(backtestService.getRunsByStatus(status));
    }
}
