package com.eventbacktest.backtester.controller;

import com.eventbacktest.backtester.controller.dto.IngestionResponse;
import com.eventbacktest.backtester.service.MarketDataIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * REST controller for loading daily prices.
 */
@RestController
@RequestMapping("/market-data")
@RequiredArgsConstructor
@Slf4j
public class MarketDataController {

    private final MarketDataIngestionService ingestionService;

    /**
     * Ingest a per-symbol bar file posted as the request body.
     */
    @PostMapping(value = "/{symbol}", consumes = { "text/csv", MediaType.TEXT_PLAIN_VALUE })
    public ResponseEntity<IngestionResponse> ingest(@PathVariable String symbol, @RequestBody String csv)
            throws IOException {

        log.info("POST /market-data/{} - {} bytes", symbol, csv.length());

        int inserted = ingestionService.ingestCsv(symbol,
                new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));

        IngestionResponse response = IngestionResponse.builder()
                .symbol(symbol)
                .inserted(inserted)
                .totalRecords(ingestionService.countRecords(symbol))
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{symbol}")
    public ResponseEntity<Void> delete(@PathVariable String symbol) {

        log.info("DELETE /market-data/{}", symbol);

        ingestionService.deleteSymbolData(symbol);
        return ResponseEntity.noContent().build();
    }
}
