package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays pre-loaded per-symbol series, aligned onto their shared timestamp
 * union, one synchronized step per {@link #updateBars()} call.
 */
@Slf4j
public class HistoricBarSource extends AbstractBarSource {

    private final AlignedSeries aligned;
    private int cursor = 0;

    public HistoricBarSource(EventQueue events, List<String> symbols, Map<String, List<Bar>> nativeSeries) {
        super(events, symbols);
        for (String symbol : symbols) {
            List<Bar> bars = nativeSeries.get(symbol);
            if (bars == null || bars.isEmpty()) {
                throw new BacktestConfigurationException("No bars available for symbol " + symbol);
            }
        }
        Map<String, List<Bar>> tracked = new HashMap<>();
        symbols.forEach(symbol -> tracked.put(symbol, nativeSeries.get(symbol)));
        this.aligned = SeriesAligner.align(tracked);

        log.info("Historic bar source ready - Symbols: {}, Synchronized steps: {}",
                symbols, aligned.length());
    }

    @Override
    public boolean updateBars() {
        if (isExhausted()) {
            return false;
        }
        for (String symbol : getSymbols()) {
            if (cursor >= aligned.getSeries().get(symbol).size()) {
                markExhausted();
                return false;
            }
        }

        Map<String, Bar> step = new HashMap<>();
        for (String symbol : getSymbols()) {
            Bar bar = aligned.barAt(symbol, cursor);
            if (bar != null) {
                step.put(symbol, bar);
            }
        }
        appendStep(aligned.getIndex().get(cursor), step);
        cursor++;
        return true;
    }

    /**
     * Number of synchronized steps in the replay.
     */
    public int getLength() {
        return aligned.length();
    }
}
