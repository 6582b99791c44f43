package com.eventbacktest.backtester.controller;

import com.eventbacktest.backtester.controller.dto.ErrorResponse;
import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.BacktestRunNotFoundException;
import com.eventbacktest.backtester.domain.InvalidBarFieldException;
import com.eventbacktest.backtester.domain.UnknownSymbolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain failures to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({ BacktestConfigurationException.class, InvalidBarFieldException.class })
    public ResponseEntity<ErrorResponse> badConfiguration(RuntimeException ex) {
        log.warn("Rejected run configuration: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.builder()
                .reason("configuration_error")
                .message(ex.getMessage())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.builder()
                .reason("validation_error")
                .message("invalid_request")
                .fields(fields)
                .build());
    }

    @ExceptionHandler({ BacktestRunNotFoundException.class, UnknownSymbolException.class })
    public ResponseEntity<ErrorResponse> notFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .reason("not_found")
                .message(ex.getMessage())
                .build());
    }
}
