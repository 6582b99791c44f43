package com.eventbacktest.backtester.domain.data;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single OHLCV bar with adjusted close, keyed by (symbol, timestamp).
 */
@Value
@Builder
public class Bar {

    @NonNull
    String symbol;

    @With
    @NonNull
    LocalDateTime timestamp;

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
    BigDecimal adjClose;
}
