package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.infrastructure.EventQueue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Historic bar source reading one {@code <SYMBOL>.csv} file per symbol from a directory.
 */
public class CsvBarSource extends HistoricBarSource {

    private final Path csvDir;

    public CsvBarSource(EventQueue events, Path csvDir, List<String> symbols) {
        super(events, symbols, loadAll(csvDir, symbols));
        this.csvDir = csvDir;
    }

    public Path getCsvDir() {
        return csvDir;
    }

    private static Map<String, List<Bar>> loadAll(Path csvDir, List<String> symbols) {
        Map<String, List<Bar>> nativeSeries = new LinkedHashMap<>();
        for (String symbol : symbols) {
            nativeSeries.put(symbol, BarCsvReader.read(symbol, csvDir.resolve(symbol + ".csv")));
        }
        return nativeSeries;
    }
}
