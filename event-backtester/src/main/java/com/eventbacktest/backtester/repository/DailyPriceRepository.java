package com.eventbacktest.backtester.repository;

import com.eventbacktest.backtester.domain.DailyPrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for accessing daily prices from the securities master.
 */
@Repository
public interface DailyPriceRepository extends JpaRepository<DailyPrice, Long> {

    /**
     * Find prices for a ticker within a date range, ordered by date.
     */
    @Query("SELECT p FROM DailyPrice p WHERE p.ticker = :ticker " +
            "AND p.priceDate >= :startDate AND p.priceDate <= :endDate ORDER BY p.priceDate ASC")
    List<DailyPrice> findByTickerAndDateRange(
            @Param("ticker") String ticker,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    /**
     * Check if a price exists for a ticker and date.
     */
    boolean existsByTickerAndPriceDate(String ticker, LocalDate priceDate);

    long countByTicker(String ticker);

    /**
     * Delete all prices for a specific ticker.
     */
    void deleteByTicker(String ticker);
}
