package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.config.BacktestProperties;
import com.eventbacktest.backtester.controller.dto.BacktestRunRequest;
import com.eventbacktest.backtester.controller.dto.BacktestRunResponse;
import com.eventbacktest.backtester.domain.BacktestEngine;
import com.eventbacktest.backtester.domain.BacktestEngine.BacktestReport;
import com.eventbacktest.backtester.domain.BacktestRun;
import com.eventbacktest.backtester.domain.BacktestRunNotFoundException;
import com.eventbacktest.backtester.domain.RunStatus;
import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.execution.BrokerExecutionHandler;
import com.eventbacktest.backtester.domain.execution.CommissionModel;
import com.eventbacktest.backtester.domain.execution.ExecutionHandler;
import com.eventbacktest.backtester.domain.execution.ExecutionMode;
import com.eventbacktest.backtester.domain.execution.PaperBrokerSession;
import com.eventbacktest.backtester.domain.execution.SimulatedExecutionHandler;
import com.eventbacktest.backtester.domain.portfolio.EquityCurveCsvWriter;
import com.eventbacktest.backtester.domain.portfolio.PerformanceReport;
import com.eventbacktest.backtester.domain.portfolio.Portfolio;
import com.eventbacktest.backtester.domain.strategy.Strategy;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.eventbacktest.backtester.infrastructure.InMemoryEventQueue;
import com.eventbacktest.backtester.repository.BacktestRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Implementation of BacktestService. Runs are executed synchronously on the
 * calling thread; each run gets its own event queue and roles. In
 * {@code PAPER_BROKER} mode orders go through a per-run paper broker session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestRunRepository backtestRunRepository;
    private final StrategyFactory strategyFactory;
    private final BarSourceFactory barSourceFactory;
    private final CommissionModel commissionModel;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    public BacktestRunResponse runBacktest(BacktestRunRequest request) {
        log.info("Received backtest run for strategy: {}, symbols: {}",
                request.getStrategyName(), request.getSymbols());

        String parametersJson = toJson(request.getParameters() == null ? Map.of() : request.getParameters());
        BigDecimal initialCapital = request.getInitialCapital() != null
                ? request.getInitialCapital()
                : properties.getInitialCapital();

        BacktestRun run = backtestRunRepository.save(BacktestRun.builder()
                .strategyName(request.getStrategyName())
                .symbols(String.join(",", request.getSymbols()))
                .parametersJson(parametersJson)
                .status(RunStatus.RUNNING)
                .initialCapital(initialCapital)
                .build());

        MDC.put("runId", String.valueOf(run.getId()));
        long startTime = System.currentTimeMillis();

        try {
            log.info("Started");
            BacktestReport report = execute(request, parametersJson, initialCapital);
            long executionTimeMs = System.currentTimeMillis() - startTime;

            markCompleted(run, report, executionTimeMs);
            BacktestRun saved = backtestRunRepository.save(run);
            metricsService.recordRunCompleted(report, executionTimeMs);
            log.info("Status changed to COMPLETED in {} ms", executionTimeMs);

            exportEquityCurve(saved.getId(), report.getPerformance());

            BacktestRunResponse response = toResponse(saved);
            response.setMessage(report.isCancelled() ? "Run cancelled before exhaustion" : "Run completed");
            return response;

        } catch (RuntimeException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            run.setStatus(RunStatus.FAILED);
            run.setFailureReason(e.getMessage());
            run.setExecutionTimeMs(System.currentTimeMillis() - startTime);
            backtestRunRepository.save(run);
            metricsService.recordRunFailed();
            throw e;
        } finally {
            MDC.remove("runId");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public BacktestRunResponse getRun(Long runId) {
        BacktestRun run = backtestRunRepository.findById(runId)
                .orElseThrow(() -> new BacktestRunNotFoundException(runId));
        return toResponse(run);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BacktestRunResponse> getRunsByStatus(RunStatus status) {
        return backtestRunRepository.findByStatusOrderByCreatedAtDesc(status).stream()
                .map(this::toSummary)
                .collect(Collectors.toList());
    }

    private BacktestReport execute(BacktestRunRequest request, String parametersJson, BigDecimal initialCapital) {
        EventQueue events = new InMemoryEventQueue();
        BarSource bars = barSourceFactory.create(request.getSource(), request.getSymbols(),
                request.getStartDate(), request.getEndDate(), events);
        Strategy strategy = strategyFactory.createStrategy(request.getStrategyName(), parametersJson, bars, events);

        long orderQuantity = request.getOrderQuantity() != null
                ? request.getOrderQuantity()
                : properties.getOrderQuantity();

        Portfolio portfolio = new Portfolio(bars, events, initialCapital, orderQuantity);
        ExecutionMode mode = request.getExecutionMode() != null
                ? request.getExecutionMode()
                : properties.getExecutionMode();
        log.info("Executing orders in {} mode", mode);

        if (mode == ExecutionMode.PAPER_BROKER) {
            try (PaperBrokerSession session = new PaperBrokerSession(
                    symbol -> bars.getLatestBarValue(symbol, BarField.CLOSE).orElse(null))) {
                BrokerExecutionHandler execution = new BrokerExecutionHandler(events, session, commissionModel,
                        properties.getBrokerOrderRouting(), properties.getExchange(), properties.getBrokerCurrency());
                return buildEngine(events, bars, strategy, portfolio, execution).run();
            }
        }
        SimulatedExecutionHandler execution = new SimulatedExecutionHandler(
                events, bars, commissionModel, properties.getExchange());
        return buildEngine(events, bars, strategy, portfolio, execution).run();
    }

    private BacktestEngine buildEngine(EventQueue events, BarSource bars, Strategy strategy, Portfolio portfolio,
                                       ExecutionHandler execution) {
        return BacktestEngine.builder()
                .events(events)
                .bars(bars)
                .strategy(strategy)
                .portfolio(portfolio)
                .execution(execution)
                .heartbeat(properties.getHeartbeat())
                .periodsPerYear(properties.getPeriodsPerYear())
                .settleTimeout(properties.getSettleTimeout())
                .build();
    }

    private void markCompleted(BacktestRun run, BacktestReport report, long executionTimeMs) {
        PerformanceReport performance = report.getPerformance();
        run.setStatus(RunStatus.COMPLETED);
        run.setFinalEquity(performance.getFinalEquity());
        run.setTotalReturn(performance.getTotalReturn());
        run.setSharpeRatio(performance.getSharpeRatio());
        run.setMaxDrawdown(performance.getMaxDrawdown());
        run.setDrawdownDuration(performance.getDrawdownDuration());
        run.setSignalCount((int) report.getSignalCount());
        run.setOrderCount((int) report.getOrderCount());
        run.setFillCount((int) report.getFillCount());
        run.setExecutionTimeMs(executionTimeMs);
        run.setEquityCurveJson(toJson(performance.getEquityCurve()));
    }

    private void exportEquityCurve(Long runId, PerformanceReport performance) {
        if (!properties.isEquityExportEnabled()) {
            return;
        }
        Path target = properties.getEquityOutputDir().resolve("equity-" + runId + ".csv");
        try {
            EquityCurveCsvWriter.write(performance, target);
            log.info("Equity curve written to {}", target);
        } catch (IOException e) {
            log.error("Failed to write equity curve to {}: {}", target, e.getMessage(), e);
        }
    }

    private BacktestRunResponse toResponse(BacktestRun run) {
        BacktestRunResponse response = toSummary(run);
        response.setEquityCurve(readJson(run.getEquityCurveJson()));
        return response;
    }

    private BacktestRunResponse toSummary(BacktestRun run) {
        return BacktestRunResponse.builder()
                .runId(run.getId())
                .strategyName(run.getStrategyName())
                .symbols(Arrays.asList(run.getSymbols().split(",")))
                .status(run.getStatus())
                .initialCapital(run.getInitialCapital())
                .finalEquity(run.getFinalEquity())
                .totalReturn(run.getTotalReturn())
                .sharpeRatio(run.getSharpeRatio())
                .maxDrawdown(run.getMaxDrawdown())
                .drawdownDuration(run.getDrawdownDuration())
                .signalCount(run.getSignalCount())
                .orderCount(run.getOrderCount())
                .fillCount(run.getFillCount())
                .executionTimeMs(run.getExecutionTimeMs())
                .failureReason(run.getFailureReason())
                .createdAt(run.getCreatedAt())
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON", e);
            throw new IllegalStateException("Failed to serialize run data", e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Stored equity curve is not valid JSON", e);
            throw new IllegalStateException("Corrupt equity curve for run", e);
        }
    }
}
