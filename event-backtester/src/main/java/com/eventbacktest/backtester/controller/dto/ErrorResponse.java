package com.eventbacktest.backtester.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorResponse {

    private String reason;
    private String message;
    private Map<String, String> fields;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
