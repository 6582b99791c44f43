package com.eventbacktest.backtester.domain.execution;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Instrument description handed to the broker.
 */
@Value
@Builder
public class ContractSpec {

    @NonNull
    String symbol;

    @Builder.Default
    String securityType = "STK";

    /** Routing destination, e.g. SMART. */
    String exchange;

    String primaryExchange;

    @Builder.Default
    String currency = "USD";
}
