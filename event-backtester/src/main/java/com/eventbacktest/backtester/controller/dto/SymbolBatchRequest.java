package com.eventbacktest.backtester.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of securities to add to the symbol master.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SymbolBatchRequest {

    @NotEmpty(message = "At least one symbol is required")
    private List<@Valid SymbolEntry> symbols;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SymbolEntry {

        @NotBlank(message = "Ticker is required")
        private String ticker;

        @Builder.Default
        private String instrument = "stock";

        private String name;
        private String sector;

        @Builder.Default
        private String currency = "USD";
    }
}
