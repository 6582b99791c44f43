package com.eventbacktest.backtester.domain.portfolio;

import com.eventbacktest.backtester.domain.UnknownSymbolException;
import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.event.FillEvent;
import com.eventbacktest.backtester.domain.event.MarketEvent;
import com.eventbacktest.backtester.domain.event.OrderDirection;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.domain.event.OrderType;
import com.eventbacktest.backtester.domain.event.SignalEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks positions, cash and the equity curve.
 *
 * <p>Only fills change cash and positions. Signals only decide whether an
 * order is placed: an entry is ignored unless the symbol is flat, and EXIT
 * closes whatever is open, so a position is never reversed in one order.
 */
@Slf4j
public class Portfolio {

    private final BarSource bars;
    private final EventQueue events;
    private final BigDecimal initialCapital;
    private final long orderQuantity;
    private final BarField priceField;

    private final Map<String, Long> positions = new LinkedHashMap<>();
    private final List<EquitySnapshot> equityCurve = new ArrayList<>();
    private final List<FillEvent> fills = new ArrayList<>();

    private BigDecimal cash;
    private BigDecimal totalCommission = BigDecimal.ZERO;

    public Portfolio(BarSource bars, EventQueue events, BigDecimal initialCapital, long orderQuantity) {
        this(bars, events, initialCapital, orderQuantity, BarField.CLOSE);
    }

    public Portfolio(BarSource bars, EventQueue events, BigDecimal initialCapital,
                     long orderQuantity, BarField priceField) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive");
        }
        if (orderQuantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive");
        }
        this.bars = bars;
        this.events = events;
        this.initialCapital = initialCapital;
        this.orderQuantity = orderQuantity;
        this.priceField = priceField;
        this.cash = initialCapital;

        for (String symbol : bars.getSymbols()) {
            positions.put(symbol, 0L);
        }
    }

    /**
     * Mark every position to the latest known price and record one equity
     * snapshot for the current timestep. A repeated call for the same
     * timestep replaces that timestep's snapshot instead of adding a row.
     */
    public void updateTimeindex(MarketEvent event) {
        LocalDateTime timestamp = bars.getCurrentDatetime().orElse(null);

        Map<String, BigDecimal> marketValues = new LinkedHashMap<>();
        BigDecimal total = cash;
        for (Map.Entry<String, Long> position : positions.entrySet()) {
            BigDecimal price = bars.getLatestBarValue(position.getKey(), priceField).orElse(BigDecimal.ZERO);
            BigDecimal marketValue = price.multiply(BigDecimal.valueOf(position.getValue()));
            marketValues.put(position.getKey(), marketValue);
            total = total.add(marketValue);
        }

        EquitySnapshot snapshot = EquitySnapshot.builder()
                .timestamp(timestamp)
                .cash(cash)
                .commission(totalCommission)
                .positions(Collections.unmodifiableMap(new LinkedHashMap<>(positions)))
                .marketValues(Collections.unmodifiableMap(marketValues))
                .total(total)
                .build();

        int last = equityCurve.size() - 1;
        if (last >= 0 && timestamp != null && timestamp.equals(equityCurve.get(last).getTimestamp())) {
            equityCurve.set(last, snapshot);
        } else {
            equityCurve.add(snapshot);
        }
        log.debug("Equity at {}: cash={}, total={}", timestamp, cash, total);
    }

    /**
     * Translate a signal into at most one market order.
     */
    public void updateSignal(SignalEvent signal) {
        OrderEvent order = generateOrder(signal);
        if (order != null) {
            events.push(order);
            log.debug("Order generated: {} {} {} (signal {} strength {})",
                    order.getDirection(), order.getQuantity(), order.getSymbol(),
                    signal.getDirection(), signal.getStrength());
        }
    }

    /**
     * Apply a realized trade to cash and positions.
     * Commission is always a cost, whichever side the fill is on.
     */
    public void updateFill(FillEvent fill) {
        long current = position(fill.getSymbol());
        int sign = fill.getDirection().sign();

        positions.put(fill.getSymbol(), current + sign * fill.getQuantity());
        cash = cash.subtract(fill.getGrossValue().multiply(BigDecimal.valueOf(sign)))
                .subtract(fill.getCommission());
        totalCommission = totalCommission.add(fill.getCommission());
        fills.add(fill);

        log.debug("Fill applied: {} {} {} at {} (commission {}). Position: {}, Cash: {}",
                fill.getDirection(), fill.getQuantity(), fill.getSymbol(), fill.getFillCost(),
                fill.getCommission(), positions.get(fill.getSymbol()), cash);
    }

    /**
     * Finalize the equity curve into returns, drawdowns and summary statistics.
     */
    public PerformanceReport createPerformanceReport(int periodsPerYear) {
        return PerformanceMetrics.buildReport(equityCurve, periodsPerYear);
    }

    private OrderEvent generateOrder(SignalEvent signal) {
        String symbol = signal.getSymbol();
        long current = position(symbol);
        long quantity = Math.max(1L, Math.round(orderQuantity * signal.getStrength()));

        switch (signal.getDirection()) {
            case LONG:
                if (current == 0) {
                    return marketOrder(symbol, quantity, OrderDirection.BUY);
                }
                break;
            case SHORT:
                if (current == 0) {
                    return marketOrder(symbol, quantity, OrderDirection.SELL);
                }
                break;
            case EXIT:
                if (current > 0) {
                    return marketOrder(symbol, current, OrderDirection.SELL);
                }
                if (current < 0) {
                    return marketOrder(symbol, -current, OrderDirection.BUY);
                }
                break;
            default:
                break;
        }
        log.debug("Signal {} on {} ignored with position {}", signal.getDirection(), symbol, current);
        return null;
    }

    private static OrderEvent marketOrder(String symbol, long quantity, OrderDirection direction) {
        return OrderEvent.builder()
                .symbol(symbol)
                .orderType(OrderType.MARKET)
                .quantity(quantity)
                .direction(direction)
                .build();
    }

    private long position(String symbol) {
        Long position = positions.get(symbol);
        if (position == null) {
            throw new UnknownSymbolException(symbol);
        }
        return position;
    }

    public long getPosition(String symbol) {
        return position(symbol);
    }

    public Map<String, Long> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getTotalCommission() {
        return totalCommission;
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public List<EquitySnapshot> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public List<FillEvent> getFills() {
        return Collections.unmodifiableList(fills);
    }
}
