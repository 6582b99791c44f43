package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.controller.dto.BacktestRunRequest;
import com.eventbacktest.backtester.controller.dto.BacktestRunResponse;
import com.eventbacktest.backtester.domain.RunStatus;

import java.util.List;

/**
 * Service interface for backtest run operations.
 */
public interface BacktestService {

    /**
     * Run a backtest to completion and persist its outcome.
     *
     * @param request the run request
     * @return the completed run with its statistics
     */
    BacktestRunResponse runBacktest(BacktestRunRequest request);

    /**
     * @throws com.eventbacktest.backtester.domain.BacktestRunNotFoundException if no run has this id
     */
    BacktestRunResponse getRun(Long runId);

    List<BacktestRunResponse> getRunsByStatus(RunStatus status);
}
