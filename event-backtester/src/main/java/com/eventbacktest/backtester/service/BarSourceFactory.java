package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.config.BacktestProperties;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.data.BarSourceType;
import com.eventbacktest.backtester.domain.data.CsvBarSource;
import com.eventbacktest.backtester.domain.data.Bar;
import com.eventbacktest.backtester.domain.data.DatabaseBarSource;
import com.eventbacktest.backtester.domain.data.FeedReplayer;
import com.eventbacktest.backtester.domain.data.LiveFeedBarSource;
import com.eventbacktest.backtester.domain.data.SeriesAligner;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.eventbacktest.backtester.repository.DailyPriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Builds the bar source a run consumes. {@code LIVE_REPLAY} pushes stored
 * daily prices through a live feed from a background thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BarSourceFactory {

    private final DailyPriceRepository dailyPriceRepository;
    private final BacktestProperties properties;

    public BarSource create(BarSourceType type, List<String> symbols, LocalDate startDate, LocalDate endDate,
                            EventQueue events) {
        BarSourceType sourceType = type == null ? BarSourceType.CSV : type;
        log.info("Creating {} bar source for {}", sourceType, symbols);

        return switch (sourceType) {
            case CSV -> new CsvBarSource(events, properties.getCsvDir(), symbols);
            case DATABASE -> {
                requireDateRange(sourceType, startDate, endDate);
                yield new DatabaseBarSource(events, dailyPriceRepository, symbols, startDate, endDate);
            }
            case LIVE_REPLAY -> {
                requireDateRange(sourceType, startDate, endDate);
                yield startReplay(symbols, startDate, endDate, events);
            }
        };
    }

    private LiveFeedBarSource startReplay(List<String> symbols, LocalDate startDate, LocalDate endDate,
                                          EventQueue events) {
        Map<String, List<Bar>> stored = DatabaseBarSource.loadNativeSeries(
                dailyPriceRepository, symbols, startDate, endDate);
        for (Map.Entry<String, List<Bar>> entry : stored.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new BacktestConfigurationException("No bars for symbol " + entry.getKey());
            }
        }
        LiveFeedBarSource feed = new LiveFeedBarSource(events, symbols, properties.getLivePollTimeout());
        new FeedReplayer(feed, SeriesAligner.align(stored), properties.getLiveReplayInterval()).start();
        return feed;
    }

    private static void requireDateRange(BarSourceType type, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new BacktestConfigurationException(type + " source requires startDate and endDate");
        }
        if (startDate.isAfter(endDate)) {
            throw new BacktestConfigurationException(
                    "Start date " + startDate + " is after end date " + endDate);
        }
    }
}
