package com.eventbacktest.backtester.domain.execution;

import java.math.BigDecimal;

/**
 * Inbound broker notifications. Callbacks may arrive on any thread, in any
 * order, and more than once for the same order.
 */
public interface BrokerMessageListener {

    void onOpenOrder(int orderId, ContractSpec contract, OrderSpec order);

    void onOrderStatus(int orderId, BrokerOrderStatus status, long filledQuantity, BigDecimal averageFillPrice);

    void onError(int orderId, int code, String message);
}
