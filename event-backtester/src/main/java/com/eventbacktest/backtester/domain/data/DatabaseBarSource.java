package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.domain.DailyPrice;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.eventbacktest.backtester.repository.DailyPriceRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Historic bar source reading daily prices from the securities master.
 */
@Slf4j
public class DatabaseBarSource extends HistoricBarSource {

    public DatabaseBarSource(EventQueue events, DailyPriceRepository repository,
                             List<String> symbols, LocalDate startDate, LocalDate endDate) {
        super(events, symbols, loadNativeSeries(repository, symbols, startDate, endDate));
    }

    /**
     * Stored daily prices per symbol, in symbol order, each ascending by date.
     */
    public static Map<String, List<Bar>> loadNativeSeries(DailyPriceRepository repository, List<String> symbols,
                                                          LocalDate startDate, LocalDate endDate) {
        Map<String, List<Bar>> nativeSeries = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<Bar> bars = repository.findByTickerAndDateRange(symbol, startDate, endDate).stream()
                    .map(DailyPrice::toBar)
                    .collect(Collectors.toList());
            log.info("Loaded {} daily prices for {} from {} to {}", bars.size(), symbol, startDate, endDate);
            nativeSeries.put(symbol, bars);
        }
        return nativeSeries;
    }
}
