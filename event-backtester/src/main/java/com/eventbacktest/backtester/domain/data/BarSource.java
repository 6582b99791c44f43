package com.eventbacktest.backtester.domain.data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Supplies one synchronized bar per symbol per timestep.
 * Historic and live implementations are treated identically by strategies,
 * the portfolio and the orchestrator.
 *
 * Every lookup method throws {@link com.eventbacktest.backtester.domain.UnknownSymbolException}
 * for a symbol the source does not track. Insufficient history is never an
 * error: lookups return empty results instead.
 */
public interface BarSource {

    /**
     * Symbols tracked by this source, in configuration order.
     */
    List<String> getSymbols();

    /**
     * The most recent bar observed for the symbol.
     */
    Optional<Bar> getLatestBar(String symbol);

    /**
     * The most recent min(n, available) bars in chronological order.
     */
    List<Bar> getLatestBars(String symbol, int n);

    Optional<LocalDateTime> getLatestBarDatetime(String symbol);

    Optional<BigDecimal> getLatestBarValue(String symbol, BarField field);

    /**
     * The most recent min(n, available) values of a field in chronological order.
     */
    List<BigDecimal> getLatestBarsValues(String symbol, BarField field, int n);

    /**
     * Timestamp of the latest synchronized step, empty before the first step.
     */
    Optional<LocalDateTime> getCurrentDatetime();

    /**
     * Advance every symbol by one synchronized step and push one MarketEvent.
     *
     * @return true if a step was taken, false if no bars were available
     */
    boolean updateBars();

    /**
     * True once the source can never produce another step.
     */
    boolean isExhausted();
}
