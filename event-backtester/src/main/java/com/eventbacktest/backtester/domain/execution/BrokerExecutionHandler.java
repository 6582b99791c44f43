package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.event.FillEvent;
import com.eventbacktest.backtester.domain.event.OrderDirection;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes orders to a live broker session and converts broker fill reports
 * into FillEvents.
 *
 * <p>Order metadata is recorded before the order leaves, so a fill report
 * racing ahead of the open-order acknowledgement can still be resolved.
 * Brokers commonly repeat the "filled" status; only the first priced report
 * per order produces a FillEvent. An order stays outstanding until its fill
 * has been queued or the broker reports it cancelled or inactive.
 */
@Slf4j
public class BrokerExecutionHandler implements ExecutionHandler, BrokerMessageListener {

    private final EventQueue events;
    private final BrokerSession session;
    private final CommissionModel commissionModel;
    private final String orderRouting;
    private final String primaryExchange;
    private final String currency;
    private final Clock clock;

    private final Object submitLock = new Object();
    private final ConcurrentMap<Integer, OrderFillState> fillStates = new ConcurrentHashMap<>();

    // guarded by submitLock
    private int nextOrderId;

    public BrokerExecutionHandler(EventQueue events, BrokerSession session, CommissionModel commissionModel,
                                  String orderRouting, String primaryExchange, String currency) {
        this(events, session, commissionModel, orderRouting, primaryExchange, currency, Clock.systemUTC());
    }

    public BrokerExecutionHandler(EventQueue events, BrokerSession session, CommissionModel commissionModel,
                                  String orderRouting, String primaryExchange, String currency, Clock clock) {
        this.events = events;
        this.session = session;
        this.commissionModel = commissionModel;
        this.orderRouting = orderRouting;
        this.primaryExchange = primaryExchange;
        this.currency = currency;
        this.clock = clock;
        this.nextOrderId = session.initialOrderId();
        session.registerListener(this);
    }

    @Override
    public void executeOrder(OrderEvent order) {
        ContractSpec contract = ContractSpec.builder()
                .symbol(order.getSymbol())
                .exchange(orderRouting)
                .primaryExchange(primaryExchange)
                .currency(currency)
                .build();

        OrderSpec orderSpec = OrderSpec.builder()
                .orderType(order.getOrderType())
                .quantity(order.getQuantity())
                .action(order.getDirection())
                .build();

        synchronized (submitLock) {
            int orderId = nextOrderId;
            fillStates.put(orderId, new OrderFillState(order.getSymbol(), primaryExchange, order.getDirection()));
            try {
                session.submit(orderId, contract, orderSpec);
            } catch (RuntimeException e) {
                fillStates.remove(orderId);
                throw e;
            }
            nextOrderId++;
            log.info("Submitted order {}: {} {} {}", orderId, order.getDirection(),
                    order.getQuantity(), order.getSymbol());
        }
    }

    @Override
    public void onOpenOrder(int orderId, ContractSpec contract, OrderSpec order) {
        OrderFillState state = fillStates.get(orderId);
        if (state == null) {
            log.debug("Ignoring open-order notification for foreign order {}", orderId);
            return;
        }
        log.debug("Broker acknowledged order {} for {}", orderId, contract.getSymbol());
    }

    @Override
    public void onOrderStatus(int orderId, BrokerOrderStatus status, long filledQuantity,
                              BigDecimal averageFillPrice) {
        switch (status) {
            case FILLED -> handleFilled(orderId, filledQuantity, averageFillPrice);
            case CANCELLED, INACTIVE -> handleTerminated(orderId, status);
            default -> log.debug("Order {} status {}", orderId, status);
        }
    }

    private void handleFilled(int orderId, long filledQuantity, BigDecimal averageFillPrice) {
        OrderFillState state = fillStates.get(orderId);
        if (state == null) {
            log.warn("Fill reported for unknown order {}", orderId);
            return;
        }
        if (averageFillPrice == null) {
            log.warn("Fill report for order {} carries no price, waiting for a complete report", orderId);
            return;
        }

        FillEvent fill = FillEvent.builder()
                .timestamp(LocalDateTime.now(clock))
                .symbol(state.getSymbol())
                .exchange(state.getExchange())
                .quantity(filledQuantity)
                .direction(state.getDirection())
                .fillCost(averageFillPrice)
                .commission(commissionModel.calculate(filledQuantity, averageFillPrice))
                .build();

        if (!state.markFilled()) {
            log.debug("Duplicate fill report for order {} suppressed", orderId);
            return;
        }

        events.push(fill);
        state.settle();
        log.info("Order {} filled: {} {} at {}", orderId, filledQuantity, state.getSymbol(), averageFillPrice);
    }

    private void handleTerminated(int orderId, BrokerOrderStatus status) {
        OrderFillState state = fillStates.get(orderId);
        if (state == null || state.isFilled()) {
            log.debug("Order {} status {}", orderId, status);
            return;
        }
        state.settle();
        log.warn("Order {} ended {} without a fill", orderId, status);
    }

    @Override
    public void onError(int orderId, int code, String message) {
        log.warn("Broker error {} for order {}: {}", code, orderId, message);
    }

    public int getNextOrderId() {
        synchronized (submitLock) {
            return nextOrderId;
        }
    }

    @Override
    public int getOutstandingOrderCount() {
        return (int) fillStates.values().stream().filter(state -> !state.isSettled()).count();
    }

    public boolean isFilled(int orderId) {
        OrderFillState state = fillStates.get(orderId);
        return state != null && state.isFilled();
    }

    @Getter
    static final class OrderFillState {
        private final String symbol;
        private final String exchange;
        private final OrderDirection direction;
        @Getter(lombok.AccessLevel.NONE)
        private final AtomicBoolean filled = new AtomicBoolean(false);
        @Getter(lombok.AccessLevel.NONE)
        private volatile boolean settled = false;

        OrderFillState(String symbol, String exchange, OrderDirection direction) {
            this.symbol = symbol;
            this.exchange = exchange;
            this.direction = direction;
        }

        boolean markFilled() {
            return filled.compareAndSet(false, true);
        }

        boolean isFilled() {
            return filled.get();
        }

        // set once the fill is on the queue, or the order is dead
        void settle() {
            settled = true;
        }

        boolean isSettled() {
            return settled;
        }
    }
}
