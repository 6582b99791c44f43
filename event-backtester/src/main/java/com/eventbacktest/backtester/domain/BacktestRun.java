package com.eventbacktest.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Entity representing one backtest run together with its summary statistics.
 */
@Entity
@Table(name = "backtest_runs", indexes = {
        @Index(name = "idx_run_status", columnList = "status"),
        @Index(name = "idx_run_created_at", columnList = "created_at"),
        @Index(name = "idx_run_strategy_name", columnList = "strategy_name")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "strategy_name", nullable = false, length = 255)
    private String strategyName;

    /**
     * Comma-separated tracked symbols.
     */
    @Column(name = "symbols", nullable = false, length = 512)
    private String symbols;

    @Column(name = "parameters_json", columnDefinition = "TEXT")
    private String parametersJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "initial_capital", nullable = false, precision = 19, scale = 4)
    private BigDecimal initialCapital;

    @Column(name = "final_equity", precision = 19, scale = 4)
    private BigDecimal finalEquity;

    @Column(name = "total_return", precision = 12, scale = 4)
    private BigDecimal totalReturn;

    @Column(name = "sharpe_ratio", precision = 12, scale = 4)
    private BigDecimal sharpeRatio;

    @Column(name = "max_drawdown", precision = 12, scale = 4)
    private BigDecimal maxDrawdown;

    @Column(name = "drawdown_duration")
    private Integer drawdownDuration;

    @Column(name = "signal_count")
    private Integer signalCount;

    @Column(name = "order_count")
    private Integer orderCount;

    @Column(name = "fill_count")
    private Integer fillCount;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "equity_curve_json", columnDefinition = "TEXT")
    private String equityCurveJson;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
