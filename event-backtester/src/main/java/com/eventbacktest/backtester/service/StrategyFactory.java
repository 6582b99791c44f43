package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.eventbacktest.backtester.domain.strategy.PairsMeanReversionStrategy;
import com.eventbacktest.backtester.domain.strategy.Strategy;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Factory for creating strategy instances based on name and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    static final int DEFAULT_SHORT_WINDOW = 100;
    static final int DEFAULT_LONG_WINDOW = 400;
    static final int DEFAULT_OLS_WINDOW = 100;
    static final double DEFAULT_ZSCORE_LOW = 0.5;
    static final double DEFAULT_ZSCORE_HIGH = 3.0;

    private final ObjectMapper objectMapper;

    /**
     * Create a strategy wired to the given bar source and event queue.
     *
     * @throws BacktestConfigurationException for an unknown name, malformed
     *                                        parameters or invalid values
     */
    public Strategy createStrategy(String strategyName, String parametersJson, BarSource bars, EventQueue events) {
        log.info("Creating strategy: {} with parameters: {}", strategyName, parametersJson);

        JsonNode params = parseParameters(parametersJson);

        try {
            return switch (strategyName.toLowerCase()) {
                case "movingaveragecrossover", "ma_crossover" -> {
                    int shortWindow = params.path("shortWindow").asInt(DEFAULT_SHORT_WINDOW);
                    int longWindow = params.path("longWindow").asInt(DEFAULT_LONG_WINDOW);
                    yield new MovingAverageCrossoverStrategy(strategyName, bars, events, shortWindow, longWindow);
                }

                case "pairsmeanreversion", "pairs_mean_reversion" -> {
                    List<String> symbols = bars.getSymbols();
                    String ySymbol = params.path("ySymbol").asText(symbols.get(0));
                    String xSymbol = params.path("xSymbol").asText(symbols.size() > 1 ? symbols.get(1) : "");
                    int olsWindow = params.path("olsWindow").asInt(DEFAULT_OLS_WINDOW);
                    double zscoreLow = params.path("zscoreLow").asDouble(DEFAULT_ZSCORE_LOW);
                    double zscoreHigh = params.path("zscoreHigh").asDouble(DEFAULT_ZSCORE_HIGH);
                    BarField priceField = params.has("priceField")
                            ? BarField.fromName(params.get("priceField").asText())
                            : BarField.CLOSE;
                    yield new PairsMeanReversionStrategy(strategyName, bars, events, ySymbol, xSymbol,
                            olsWindow, zscoreLow, zscoreHigh, priceField);
                }

                default -> throw new BacktestConfigurationException("Unknown strategy: " + strategyName);
            };
        } catch (IllegalArgumentException e) {
            throw new BacktestConfigurationException(
                    "Invalid parameters for " + strategyName + ": " + e.getMessage(), e);
        }
    }

    private JsonNode parseParameters(String parametersJson) {
        if (parametersJson == null || parametersJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(parametersJson);
        } catch (JsonProcessingException e) {
            throw new BacktestConfigurationException("Malformed strategy parameters: " + e.getOriginalMessage(), e);
        }
    }
}
