package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.controller.dto.SymbolBatchRequest.SymbolEntry;
import com.eventbacktest.backtester.domain.SecuritySymbol;
import com.eventbacktest.backtester.repository.SecuritySymbolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maintains the symbol master list. Inserts are not de-duplicated: loading
 * the same batch twice stores it twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SymbolMasterService {

    private final SecuritySymbolRepository securitySymbolRepository;
    private final Clock clock;

    @Transactional
    public List<SecuritySymbol> insertSymbols(List<SymbolEntry> entries) {
        LocalDateTime now = LocalDateTime.now(clock);

        List<SecuritySymbol> symbols = entries.stream()
                .map(entry -> SecuritySymbol.builder()
                        .ticker(entry.getTicker())
                        .instrument(entry.getInstrument())
                        .name(entry.getName())
                        .sector(entry.getSector())
                        .currency(entry.getCurrency())
                        .createdDate(now)
                        .lastUpdatedDate(now)
                        .build())
                .collect(Collectors.toList());

        List<SecuritySymbol> saved = securitySymbolRepository.saveAll(symbols);
        log.info("Inserted {} symbols into the symbol master", saved.size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<SecuritySymbol> findByTicker(String ticker) {
        return securitySymbolRepository.findByTicker(ticker);
    }

    @Transactional(readOnly = true)
    public List<SecuritySymbol> findBySector(String sector) {
        return securitySymbolRepository.findBySectorOrderByTickerAsc(sector);
    }
}
