package com.eventbacktest.backtester.domain.execution;

/**
 * Connection to a broker. Submission is fire-and-forget; outcomes come back
 * through the registered {@link BrokerMessageListener}.
 */
public interface BrokerSession {

    void registerListener(BrokerMessageListener listener);

    /**
     * Send an order. Must not block waiting for acknowledgement.
     *
     * @throws BrokerSubmissionException if the order could not be sent
     */
    void submit(int orderId, ContractSpec contract, OrderSpec order);

    /**
     * First order id this session will accept.
     */
    default int initialOrderId() {
        return 1;
    }
}
