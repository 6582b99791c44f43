package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.DailyPrice;
import com.eventbacktest.backtester.domain.data.Bar;
import com.eventbacktest.backtester.domain.data.BarCsvReader;
import com.eventbacktest.backtester.repository.DailyPriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for ingesting per-symbol bar files into the daily price table.
 * Uses the same file layout as the CSV bar source.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataIngestionService {

    private static final int BATCH_SIZE = 1000;

    private final DailyPriceRepository dailyPriceRepository;

    /**
     * Ingest CSV data from an input stream.
     * Expected header: date,open,high,low,close,volume[,adj_close]
     * Rows already stored for the same ticker and date are skipped.
     *
     * @param symbol      the ticker
     * @param inputStream the CSV input stream
     * @return number of records inserted
     */
    @Transactional
    public int ingestCsv(String symbol, InputStream inputStream) throws IOException {
        log.info("Starting CSV ingestion for symbol: {}", symbol);

        List<Bar> bars = BarCsvReader.read(symbol, inputStream);
        List<DailyPrice> batch = new ArrayList<>();
        int inserted = 0;

        for (Bar bar : bars) {
            if (dailyPriceRepository.existsByTickerAndPriceDate(symbol, bar.getTimestamp().toLocalDate())) {
                log.debug("Skipping existing price for {} on {}", symbol, bar.getTimestamp().toLocalDate());
                continue;
            }
            batch.add(DailyPrice.fromBar(bar));

            if (batch.size() >= BATCH_SIZE) {
                dailyPriceRepository.saveAll(batch);
                inserted += batch.size();
                log.info("Batch inserted {} records for {}", batch.size(), symbol);
                batch.clear();
            }
        }

        if (!batch.isEmpty()) {
            dailyPriceRepository.saveAll(batch);
            inserted += batch.size();
            log.info("Inserted final batch of {} records for {}", batch.size(), symbol);
        }

        log.info("CSV ingestion completed for {}. Inserted {}, total records in DB: {}",
                symbol, inserted, dailyPriceRepository.countByTicker(symbol));
        return inserted;
    }

    public long countRecords(String symbol) {
        return dailyPriceRepository.countByTicker(symbol);
    }

    /**
     * Delete all data for a symbol (useful for reloading).
     */
    @Transactional
    public void deleteSymbolData(String symbol) {
        log.info("Deleting all data for symbol: {}", symbol);
        dailyPriceRepository.deleteByTicker(symbol);
    }
}
