package com.eventbacktest.backtester.controller;

import com.eventbacktest.backtester.controller.dto.SymbolBatchRequest;
import com.eventbacktest.backtester.controller.dto.SymbolBatchResponse;
import com.eventbacktest.backtester.domain.SecuritySymbol;
import com.eventbacktest.backtester.service.SymbolMasterService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the symbol master list.
 */
@RestController
@RequestMapping("/symbols")
@RequiredArgsConstructor
@Slf4j
public class SymbolController {

    private final SymbolMasterService symbolMasterService;

    @PostMapping
    public ResponseEntity<SymbolBatchResponse> insertSymbols(@Valid @RequestBody SymbolBatchRequest request) {

        log.info("POST /symbols - {} symbols", request.getSymbols().size());

        List<SecuritySymbol> saved = symbolMasterService.insertSymbols(request.getSymbols());

        SymbolBatchResponse response = SymbolBatchResponse.builder()
                .inserted(saved.size())
                .tickers(saved.stream().map(SecuritySymbol::getTicker).collect(Collectors.toList()))
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{ticker}")
    public ResponseEntity<List<SecuritySymbol>> getByTicker(@PathVariable String ticker) {
        return ResponseEntity.ok(symbolMasterService.findByTicker(ticker));
    }

    @GetMapping
    public ResponseEntity<List<SecuritySymbol>> getBySector(@RequestParam String sector) {
        return ResponseEntity.ok(symbolMasterService.findBySector(sector));
    }
}
