package com.eventbacktest.backtester.controller.dto;

import com.eventbacktest.backtester.domain.data.BarSourceType;
import com.eventbacktest.backtester.domain.execution.ExecutionMode;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for running a backtest.
 * Capital, order size and execution mode fall back to the configured defaults when omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRunRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @NotEmpty(message = "At least one symbol is required")
    private List<@NotBlank(message = "Symbols must not be blank") String> symbols;

    @Builder.Default
    private BarSourceType source = BarSourceType.CSV;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    private Map<String, Object> parameters;

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @Positive(message = "Order quantity must be positive")
    private Long orderQuantity;

    private ExecutionMode executionMode;
}
