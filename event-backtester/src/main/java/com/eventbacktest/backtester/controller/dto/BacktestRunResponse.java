package com.eventbacktest.backtester.controller.dto;

import com.eventbacktest.backtester.domain.RunStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Response DTO for a backtest run.
 * Result fields are populated only once the run has completed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRunResponse {

    private Long runId;
    private String strategyName;
    private List<String> symbols;
    private RunStatus status;
    private String message;

    private BigDecimal initialCapital;
    private BigDecimal finalEquity;
    private BigDecimal totalReturn;
    private BigDecimal sharpeRatio;
    private BigDecimal maxDrawdown;
    private Integer drawdownDuration;
    private Integer signalCount;
    private Integer orderCount;
    private Integer fillCount;
    private Long executionTimeMs;
    private String failureReason;
    private LocalDateTime createdAt;

    private JsonNode equityCurve;
}
