package com.eventbacktest.backtester.repository;

import com.eventbacktest.backtester.domain.SecuritySymbol;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the symbol master list.
 */
@Repository
public interface SecuritySymbolRepository extends JpaRepository<SecuritySymbol, Long> {

    List<SecuritySymbol> findByTicker(String ticker);

    List<SecuritySymbol> findBySectorOrderByTickerAsc(String sector);
}
