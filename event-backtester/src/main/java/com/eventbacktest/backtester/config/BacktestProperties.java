package com.eventbacktest.backtester.config;

import com.eventbacktest.backtester.domain.execution.ExecutionMode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Run defaults read from the {@code backtest.*} keys.
 */
@Component
@Getter
@ToString
public class BacktestProperties {

    private final Path csvDir;
    private final BigDecimal initialCapital;
    private final Duration heartbeat;
    private final long orderQuantity;
    private final String exchange;
    private final String commissionModel;
    private final BigDecimal fixedCommission;
    private final int periodsPerYear;
    private final Path equityOutputDir;
    private final boolean equityExportEnabled;
    private final String brokerOrderRouting;
    private final String brokerCurrency;
    private final ExecutionMode executionMode;
    private final Duration settleTimeout;
    private final Duration livePollTimeout;
    private final Duration liveReplayInterval;

    public BacktestProperties(
            @Value("${backtest.csv-dir:data}") String csvDir,
            @Value("${backtest.initial-capital:100000.0}") BigDecimal initialCapital,
            @Value("${backtest.heartbeat-ms:0}") long heartbeatMs,
            @Value("${backtest.order-quantity:100}") long orderQuantity,
            @Value("${backtest.exchange:ARCA}") String exchange,
            @Value("${backtest.commission.model:fixed}") String commissionModel,
            @Value("${backtest.commission.fixed:0.0}") BigDecimal fixedCommission,
            @Value("${backtest.periods-per-year:252}") int periodsPerYear,
            @Value("${backtest.equity-output-dir:output}") String equityOutputDir,
            @Value("${backtest.equity-export-enabled:true}") boolean equityExportEnabled,
            @Value("${backtest.broker.order-routing:SMART}") String brokerOrderRouting,
            @Value("${backtest.broker.currency:USD}") String brokerCurrency,
            @Value("${backtest.execution-mode:simulated}") String executionMode,
            @Value("${backtest.broker.settle-timeout-ms:5000}") long settleTimeoutMs,
            @Value("${backtest.live.poll-timeout-ms:1000}") long livePollTimeoutMs,
            @Value("${backtest.live.replay-interval-ms:0}") long liveReplayIntervalMs) {
        this.csvDir = Path.of(csvDir);
        this.initialCapital = initialCapital;
        this.heartbeat = Duration.ofMillis(heartbeatMs);
        this.orderQuantity = orderQuantity;
        this.exchange = exchange;
        this.commissionModel = commissionModel;
        this.fixedCommission = fixedCommission;
        this.periodsPerYear = periodsPerYear;
        this.equityOutputDir = Path.of(equityOutputDir);
        this.equityExportEnabled = equityExportEnabled;
        this.brokerOrderRouting = brokerOrderRouting;
        this.brokerCurrency = brokerCurrency;
        this.executionMode = ExecutionMode.fromName(executionMode);
        this.settleTimeout = Duration.ofMillis(settleTimeoutMs);
        this.livePollTimeout = Duration.ofMillis(livePollTimeoutMs);
        this.liveReplayInterval = Duration.ofMillis(liveReplayIntervalMs);
    }
}
