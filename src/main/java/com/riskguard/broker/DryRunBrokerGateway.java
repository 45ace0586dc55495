package com.riskguard.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Gateway that only logs the commands it receives. Active unless {@code riskguard.broker.mode}
 * selects a live adapter.
 */
@Component
@ConditionalOnProperty(name = "riskguard.broker.mode", havingValue = "dry-run", matchIfMissing = true)
public class DryRunBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(DryRunBrokerGateway.class);

    @Override
    public void closePosition(String accountId, String symbol) {
        log.warn("[DRY-RUN] close position: account={} symbol={}", accountId, symbol);
    }

    @Override
    public void closeAllPositions(String accountId) {
        log.warn("[DRY-RUN] close all positions: account={}", accountId);
    }

    @Override
    public void reducePosition(String accountId, String symbol, int targetSize) {
        log.warn("[DRY-RUN] reduce position: account={} symbol={} target={}", accountId, symbol, targetSize);
    }

    @Override
    public void cancelAllOrders(String accountId) {
        log.warn("[DRY-RUN] cancel all orders: account={}", accountId);
    }
}
