package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.event.OrderDirection;
import com.eventbacktest.backtester.domain.event.OrderType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class OrderSpec {

    @NonNull
    OrderType orderType;

    long quantity;

    @NonNull
    OrderDirection action;

    public String getBrokerOrderType() {
        return orderType == OrderType.MARKET ? "MKT" : "LMT";
    }
}
