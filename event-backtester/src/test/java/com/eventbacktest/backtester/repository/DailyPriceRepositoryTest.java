package com.eventbacktest.backtester.repository;

import com.eventbacktest.backtester.config.JpaConfig;
import com.eventbacktest.backtester.domain.DailyPrice;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;
import java.util.List;

import static com.eventbacktest.backtester.domain.data.BarFixtures.bar;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for daily price queries and constraints against the embedded database.
 */
@DataJpaTest
@Import(JpaConfig.class)
class DailyPriceRepositoryTest {

    @Autowired
    private DailyPriceRepository dailyPriceRepository;

    @Test
    void testFindByTickerAndDateRange_OrderedAndBounded() {
        // Arrange - stored out of order
        dailyPriceRepository.saveAll(List.of(
                DailyPrice.fromBar(bar("SPY", 3, "473")),
                DailyPrice.fromBar(bar("SPY", 0, "470")),
                DailyPrice.fromBar(bar("SPY", 1, "471")),
                DailyPrice.fromBar(bar("QQQ", 1, "400"))));

        // Act
        List<DailyPrice> prices = dailyPriceRepository.findByTickerAndDateRange("SPY",
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));

        // Assert
        assertEquals(2, prices.size());
        assertEquals(LocalDate.of(2024, 1, 1), prices.get(0).getPriceDate());
        assertEquals(LocalDate.of(2024, 1, 2), prices.get(1).getPriceDate());
        assertNotNull(prices.get(0).getCreatedAt());
    }

    @Test
    void testUniqueTickerAndDate_Enforced() {
        dailyPriceRepository.saveAndFlush(DailyPrice.fromBar(bar("SPY", 0, "470")));

        assertThrows(DataIntegrityViolationException.class,
                () -> dailyPriceRepository.saveAndFlush(DailyPrice.fromBar(bar("SPY", 0, "471"))));
    }

    @Test
    void testExistsCountAndDelete() {
        dailyPriceRepository.saveAll(List.of(
                DailyPrice.fromBar(bar("SPY", 0, "470")),
                DailyPrice.fromBar(bar("SPY", 1, "471"))));

        assertTrue(dailyPriceRepository.existsByTickerAndPriceDate("SPY", LocalDate.of(2024, 1, 2)));
        assertEquals(2, dailyPriceRepository.countByTicker("SPY"));

        dailyPriceRepository.deleteByTicker("SPY");

        assertEquals(0, dailyPriceRepository.countByTicker("SPY"));
    }
}
