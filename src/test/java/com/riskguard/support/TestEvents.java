package com.riskguard.support;

import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.OrderKind;
import com.riskguard.domain.enums.OrderStatus;
import com.riskguard.domain.model.RiskEvent;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Builders for normalized events used across tests.
 */
public final class TestEvents {

    public static final String ACCOUNT = "PRAC-1";

    private TestEvents() {}

    public static RiskEvent trade(String tradeId, String symbol, String realizedPnl, Instant at) {
        return RiskEvent.builder()
                .kind(EventKind.TRADE_EXECUTED)
                .accountId(ACCOUNT)
                .symbol(symbol)
                .eventId(tradeId)
                .timestamp(at)
                .realizedPnl(realizedPnl != null ? new BigDecimal(realizedPnl) : null)
                .tradeSize(1)
                .build();
    }

    /** Position update as the engine sees it after filling in the previous size. */
    public static RiskEvent position(String symbol, int previousSize, int netSize) {
        return RiskEvent.builder()
                .kind(EventKind.POSITION_CHANGED)
                .accountId(ACCOUNT)
                .symbol(symbol)
                .previousSize(previousSize)
                .netSize(netSize)
                .build();
    }

    public static RiskEvent position(String symbol, int previousSize, int netSize, String averagePrice, String marketPrice) {
        return position(symbol, previousSize, netSize).toBuilder()
                .averagePrice(averagePrice != null ? new BigDecimal(averagePrice) : null)
                .marketPrice(marketPrice != null ? new BigDecimal(marketPrice) : null)
                .build();
    }

    public static RiskEvent positionWithUnrealized(String symbol, int previousSize, int netSize, String unrealizedPnl) {
        return position(symbol, previousSize, netSize).toBuilder()
                .unrealizedPnl(new BigDecimal(unrealizedPnl))
                .build();
    }

    public static RiskEvent stopOrder(String orderId, String symbol, OrderStatus status) {
        return RiskEvent.builder()
                .kind(EventKind.ORDER_CHANGED)
                .accountId(ACCOUNT)
                .symbol(symbol)
                .orderId(orderId)
                .orderKind(OrderKind.STOP)
                .orderStatus(status)
                .stopPrice(new BigDecimal("100.00"))
                .build();
    }

    public static RiskEvent accountStatus(boolean canTrade) {
        return RiskEvent.builder()
                .kind(EventKind.ACCOUNT_STATUS_CHANGED)
                .accountId(ACCOUNT)
                .canTrade(canTrade)
                .build();
    }
}
