package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.config.BacktestProperties;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.DailyPrice;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.data.BarSourceType;
import com.eventbacktest.backtester.domain.data.CsvBarSource;
import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.DatabaseBarSource;
import com.eventbacktest.backtester.domain.data.LiveFeedBarSource;
import com.eventbacktest.backtester.infrastructure.InMemoryEventQueue;
import com.eventbacktest.backtester.repository.DailyPriceRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static com.eventbacktest.backtester.domain.data.BarFixtures.bar;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BarSourceFactoryTest {

    @Mock
    private DailyPriceRepository dailyPriceRepository;

    @TempDir
    Path csvDir;

    private BarSourceFactory factory() {
        BacktestProperties properties = new BacktestProperties(csvDir.toString(), new BigDecimal("100000"), 0, 100,
                "ARCA", "fixed", BigDecimal.ZERO, 252, "output", false, "SMART", "USD", "simulated", 1000, 1000, 0);
        return new BarSourceFactory(dailyPriceRepository, properties);
    }

    @Test
    void testNullTypeDefaultsToCsvFromConfiguredDirectory() throws IOException {
        Files.writeString(csvDir.resolve("SPY.csv"), String.join("\n",
                "datetime,open,high,low,close,volume,adj_close",
                "2024-01-01,470,471,469,470,1000,470"));

        BarSource source = factory().create(null, List.of("SPY"), null, null, new InMemoryEventQueue());

        assertTrue(source instanceof CsvBarSource);
        assertEquals(List.of("SPY"), source.getSymbols());
        verifyNoInteractions(dailyPriceRepository);
    }

    @Test
    void testDatabaseSourceLoadsDateRange() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);
        when(dailyPriceRepository.findByTickerAndDateRange("SPY", start, end))
                .thenReturn(List.of(DailyPrice.fromBar(bar("SPY", 0, "470"))));

        BarSource source = factory().create(BarSourceType.DATABASE, List.of("SPY"), start, end,
                new InMemoryEventQueue());

        assertTrue(source instanceof DatabaseBarSource);
    }

    @Test
    void testDatabaseSourceRequiresBothDates() {
        assertThrows(BacktestConfigurationException.class, () -> factory().create(BarSourceType.DATABASE,
                List.of("SPY"), LocalDate.of(2024, 1, 1), null, new InMemoryEventQueue()));
        verifyNoInteractions(dailyPriceRepository);
    }

    @Test
    void testDatabaseSourceRejectsInvertedRange() {
        assertThrows(BacktestConfigurationException.class, () -> factory().create(BarSourceType.DATABASE,
                List.of("SPY"), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1), new InMemoryEventQueue()));
    }

    @Test
    void testLiveReplayPublishesStoredPricesThroughFeed() {
        // Arrange
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);
        when(dailyPriceRepository.findByTickerAndDateRange("SPY", start, end))
                .thenReturn(List.of(DailyPrice.fromBar(bar("SPY", 0, "470")), DailyPrice.fromBar(bar("SPY", 1, "472"))));

        // Act
        BarSource source = factory().create(BarSourceType.LIVE_REPLAY, List.of("SPY"), start, end,
                new InMemoryEventQueue());

        // Assert - both stored days arrive, then the feed closes
        assertTrue(source instanceof LiveFeedBarSource);
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            while (!source.isExhausted()) {
                source.updateBars();
            }
        });
        assertEquals(0, new BigDecimal("472").compareTo(source.getLatestBarValue("SPY", BarField.CLOSE).orElseThrow()));
    }

    @Test
    void testLiveReplayRejectsSymbolWithoutStoredPrices() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);
        when(dailyPriceRepository.findByTickerAndDateRange("SPY", start, end)).thenReturn(List.of());

        assertThrows(BacktestConfigurationException.class, () -> factory().create(BarSourceType.LIVE_REPLAY,
                List.of("SPY"), start, end, new InMemoryEventQueue()));
    }

    @Test
    void testLiveReplayRequiresBothDates() {
        assertThrows(BacktestConfigurationException.class, () -> factory().create(BarSourceType.LIVE_REPLAY,
                List.of("SPY"), null, LocalDate.of(2024, 1, 31), new InMemoryEventQueue()));
        verifyNoInteractions(dailyPriceRepository);
    }
}
