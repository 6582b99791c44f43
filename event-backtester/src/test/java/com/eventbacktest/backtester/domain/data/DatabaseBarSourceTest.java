package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.DailyPrice;
import com.eventbacktest.backtester.infrastructure.InMemoryEventQueue;
import com.eventbacktest.backtester.repository.DailyPriceRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

import static com.eventbacktest.backtester.domain.data.BarFixtures.bar;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseBarSourceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    @Mock
    private DailyPriceRepository repository;

    @Test
    void testReplaysStoredDailyPrices() {
        // Arrange
        when(repository.findByTickerAndDateRange("SPY", START, END)).thenReturn(List.of(
                DailyPrice.fromBar(bar("SPY", 0, "470")),
                DailyPrice.fromBar(bar("SPY", 1, "472"))));

        // Act
        DatabaseBarSource source = new DatabaseBarSource(new InMemoryEventQueue(), repository,
                List.of("SPY"), START, END);
        source.updateBars();
        source.updateBars();

        // Assert
        assertEquals(2, source.getLength());
        assertEquals(0, new BigDecimal("472").compareTo(
                source.getLatestBarValue("SPY", BarField.CLOSE).orElseThrow()));
        assertFalse(source.updateBars());
        assertTrue(source.isExhausted());
    }

    @Test
    void testSymbolWithoutStoredPricesIsAConfigurationError() {
        when(repository.findByTickerAndDateRange("GONE", START, END)).thenReturn(Collections.emptyList());

        assertThrows(BacktestConfigurationException.class, () -> new DatabaseBarSource(
                new InMemoryEventQueue(), repository, List.of("GONE"), START, END));
    }
}
