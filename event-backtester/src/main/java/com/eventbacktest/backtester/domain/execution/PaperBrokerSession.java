package com.eventbacktest.backtester.domain.execution;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * In-process stand-in for a broker connection. Acknowledges and fills every
 * order on a separate callback thread at the symbol's price when submitted,
 * reporting the fill twice the way real brokers often do.
 */
@Slf4j
public class PaperBrokerSession implements BrokerSession, AutoCloseable {

    private final Function<String, BigDecimal> priceLookup;
    private final ExecutorService callbackExecutor;
    private final List<BrokerMessageListener> listeners = new CopyOnWriteArrayList<>();

    public PaperBrokerSession(Function<String, BigDecimal> priceLookup) {
        this.priceLookup = priceLookup;
        this.callbackExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "paper-broker-callbacks");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void registerListener(BrokerMessageListener listener) {
        listeners.add(listener);
    }

    @Override
    public void submit(int orderId, ContractSpec contract, OrderSpec order) {
        // priced on the submitting thread; the lookup may not be thread-safe
        BigDecimal price = priceLookup.apply(contract.getSymbol());
        try {
            callbackExecutor.execute(() -> process(orderId, contract, order, price));
        } catch (RejectedExecutionException e) {
            throw new BrokerSubmissionException(orderId, "session closed", e);
        }
    }

    private void process(int orderId, ContractSpec contract, OrderSpec order, BigDecimal price) {
        for (BrokerMessageListener listener : listeners) {
            listener.onOpenOrder(orderId, contract, order);
            listener.onOrderStatus(orderId, BrokerOrderStatus.SUBMITTED, 0, null);
        }

        if (price == null) {
            for (BrokerMessageListener listener : listeners) {
                listener.onError(orderId, 200, "No price available for " + contract.getSymbol());
                listener.onOrderStatus(orderId, BrokerOrderStatus.CANCELLED, 0, null);
            }
            return;
        }

        for (BrokerMessageListener listener : listeners) {
            listener.onOrderStatus(orderId, BrokerOrderStatus.FILLED, order.getQuantity(), price);
            listener.onOrderStatus(orderId, BrokerOrderStatus.FILLED, order.getQuantity(), price);
        }
    }

    /**
     * Wait for all submitted orders to be processed.
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            callbackExecutor.submit(() -> { }).get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            log.warn("Paper broker still busy after {} {}", timeout, unit);
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Paper broker callback failed", e.getCause());
        }
    }

    @Override
    public void close() {
        callbackExecutor.shutdown();
        try {
            if (!callbackExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Paper broker callbacks did not finish in time, forcing shutdown");
                callbackExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            callbackExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
