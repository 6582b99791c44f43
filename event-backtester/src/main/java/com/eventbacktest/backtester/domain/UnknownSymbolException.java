package com.eventbacktest.backtester.domain;

/**
 * Exception thrown when bars or fields are requested for a symbol the bar
 * source does not track.
 */
public class UnknownSymbolException extends RuntimeException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super(String.format("Symbol %s is not available in the bar source", symbol));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
