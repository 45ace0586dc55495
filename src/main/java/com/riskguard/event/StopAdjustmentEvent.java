package com.riskguard.event;

import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Automation output of the trade-management rule: the stop price it wants on a position.
 * Counted by {@code RiskGuardMetricsService}. Placing the order is left to an external
 * order-placement adapter subscribed to this event; the engine never places or modifies orders.
 */
public class StopAdjustmentEvent extends ApplicationEvent {

    private final String accountId;
    private final String symbol;
    private final BigDecimal stopPrice;
    private final String reason;

    public StopAdjustmentEvent(Object source, String accountId, String symbol, BigDecimal stopPrice, String reason) {
        super(source);
        this.accountId = accountId;
        this.symbol = symbol;
        this.stopPrice = stopPrice;
        this.reason = reason;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getSymbol() {
        return symbol;
    }

    public BigDecimal getStopPrice() {
        return stopPrice;
    }

    public String getReason() {
        return reason;
    }
}
