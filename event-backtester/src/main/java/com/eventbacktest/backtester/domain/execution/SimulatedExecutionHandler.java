package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.event.FillEvent;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Fills every order immediately at the latest bar price, with no latency or
 * slippage. Orders for a symbol without any observed price are rejected.
 */
@Slf4j
public class SimulatedExecutionHandler implements ExecutionHandler {

    private final EventQueue events;
    private final BarSource bars;
    private final CommissionModel commissionModel;
    private final String exchange;
    private final BarField priceField;

    public SimulatedExecutionHandler(EventQueue events, BarSource bars,
                                     CommissionModel commissionModel, String exchange) {
        this(events, bars, commissionModel, exchange, BarField.CLOSE);
    }

    public SimulatedExecutionHandler(EventQueue events, BarSource bars, CommissionModel commissionModel,
                                     String exchange, BarField priceField) {
        this.events = events;
        this.bars = bars;
        this.commissionModel = commissionModel;
        this.exchange = exchange;
        this.priceField = priceField;
    }

    @Override
    public void executeOrder(OrderEvent order) {
        Optional<BigDecimal> price = bars.getLatestBarValue(order.getSymbol(), priceField);
        if (price.isEmpty()) {
            log.warn("Rejected order for {}: no price observed yet", order.getSymbol());
            return;
        }

        FillEvent fill = FillEvent.builder()
                .timestamp(bars.getCurrentDatetime().orElse(null))
                .symbol(order.getSymbol())
                .exchange(exchange)
                .quantity(order.getQuantity())
                .direction(order.getDirection())
                .fillCost(price.get())
                .commission(commissionModel.calculate(order.getQuantity(), price.get()))
                .build();

        events.push(fill);
        log.debug("Simulated fill: {} {} {} at {}", fill.getDirection(), fill.getQuantity(),
                fill.getSymbol(), fill.getFillCost());
    }
}
