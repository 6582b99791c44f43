package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.domain.UnknownSymbolException;
import com.eventbacktest.backtester.domain.event.MarketEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps the observed history of every tracked symbol and answers lookups
 * against it. Subclasses decide where the next synchronized step comes from.
 * Bars are only ever appended, never revised.
 */
@Slf4j
public abstract class AbstractBarSource implements BarSource {

    protected final EventQueue events;

    private final List<String> symbols;
    private final Map<String, List<Bar>> latestSymbolData = new LinkedHashMap<>();

    private LocalDateTime currentDatetime;
    private boolean exhausted = false;

    protected AbstractBarSource(EventQueue events, List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        this.events = events;
        this.symbols = List.copyOf(symbols);
        for (String symbol : this.symbols) {
            latestSymbolData.put(symbol, new ArrayList<>());
        }
    }

    @Override
    public List<String> getSymbols() {
        return symbols;
    }

    @Override
    public Optional<Bar> getLatestBar(String symbol) {
        List<Bar> bars = history(symbol);
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(bars.size() - 1));
    }

    @Override
    public List<Bar> getLatestBars(String symbol, int n) {
        List<Bar> bars = history(symbol);
        if (n <= 0 || bars.isEmpty()) {
            return Collections.emptyList();
        }
        int from = Math.max(0, bars.size() - n);
        return List.copyOf(bars.subList(from, bars.size()));
    }

    @Override
    public Optional<LocalDateTime> getLatestBarDatetime(String symbol) {
        return getLatestBar(symbol).map(Bar::getTimestamp);
    }

    @Override
    public Optional<BigDecimal> getLatestBarValue(String symbol, BarField field) {
        return getLatestBar(symbol).map(field::extract);
    }

    @Override
    public List<BigDecimal> getLatestBarsValues(String symbol, BarField field, int n) {
        return getLatestBars(symbol, n).stream()
                .map(field::extract)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<LocalDateTime> getCurrentDatetime() {
        return Optional.ofNullable(currentDatetime);
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Append one synchronized step and announce it with a MarketEvent.
     * A symbol missing from the step (no observation yet) keeps its history unchanged.
     */
    protected void appendStep(LocalDateTime timestamp, Map<String, Bar> step) {
        for (String symbol : symbols) {
            Bar bar = step.get(symbol);
            if (bar != null) {
                latestSymbolData.get(symbol).add(bar);
            }
        }
        currentDatetime = timestamp;
        events.push(new MarketEvent());
        log.debug("Advanced bar source to {}", timestamp);
    }

    protected void markExhausted() {
        if (!exhausted) {
            exhausted = true;
            log.info("Bar source exhausted at {}", currentDatetime);
        }
    }

    private List<Bar> history(String symbol) {
        List<Bar> bars = latestSymbolData.get(symbol);
        if (bars == null) {
            throw new UnknownSymbolException(symbol);
        }
        return bars;
    }
}
