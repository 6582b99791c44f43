package com.eventbacktest.backtester.domain;

/**
 * Exception thrown when a bar field name does not match any known field.
 */
public class InvalidBarFieldException extends RuntimeException {

    private final String fieldName;

    public InvalidBarFieldException(String fieldName) {
        super(String.format("Unknown bar field: %s", fieldName));
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
