package com.riskguard.broker;

import com.riskguard.exception.BrokerException;
import com.riskguard.exception.TransientBrokerException;

/**
 * Outbound port to the broker. Implementations translate these calls to the broker's API.
 *
 * <p>Every method either succeeds or throws. A {@link TransientBrokerException} marks a failure
 * worth retrying (timeouts, rate limits, connection resets); any other {@link BrokerException}
 * is final.
 */
public interface BrokerGateway {

    void closePosition(String accountId, String symbol);

    void closeAllPositions(String accountId);

    /**
     * Reduces the position in {@code symbol} to {@code targetSize} contracts (absolute).
     */
    void reducePosition(String accountId, String symbol, int targetSize);

    void cancelAllOrders(String accountId);
}
