package com.eventbacktest.backtester.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionResponse {

    private String symbol;
    private int inserted;
    private long totalRecords;
}
