package com.riskguard.domain.model;

import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.OrderKind;
import com.riskguard.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalized, immutable trading event consumed once by the risk engine.
 *
 * <p>Which payload fields are populated depends on {@link #kind}:
 * <ul>
 *   <li>TRADE_EXECUTED: eventId (broker trade id), realizedPnl (null for a half-turn), tradeSize, price</li>
 *   <li>POSITION_CHANGED: netSize (signed), averagePrice, marketPrice, unrealizedPnl.
 *       previousSize is filled in by the engine from its position book, never by the broker adapter.</li>
 *   <li>ORDER_CHANGED: orderId, orderKind, orderStatus, stopPrice</li>
 *   <li>ACCOUNT_STATUS_CHANGED: canTrade</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RiskEvent {

    private final EventKind kind;
    private final String accountId;
    private final String symbol;
    private final Instant timestamp;
    private final String eventId;

    // TradeExecuted
    private final BigDecimal realizedPnl;
    private final Integer tradeSize;
    private final BigDecimal price;

    // PositionChanged
    private final Integer netSize;
    private final Integer previousSize;
    private final BigDecimal averagePrice;
    private final BigDecimal marketPrice;
    private final BigDecimal unrealizedPnl;

    // OrderChanged
    private final String orderId;
    private final OrderKind orderKind;
    private final OrderStatus orderStatus;
    private final BigDecimal stopPrice;

    // AccountStatusChanged
    private final Boolean canTrade;

    public boolean is(EventKind other) {
        return kind == other;
    }

    /** A trade with no realized component (an opening fill). */
    public boolean isHalfTurn() {
        return kind == EventKind.TRADE_EXECUTED && realizedPnl == null;
    }

    public int netSizeOrZero() {
        return netSize != null ? netSize : 0;
    }

    public int previousSizeOrZero() {
        return previousSize != null ? previousSize : 0;
    }

    public boolean opensPosition() {
        return kind == EventKind.POSITION_CHANGED && previousSizeOrZero() == 0 && netSizeOrZero() != 0;
    }

    public boolean closesPosition() {
        return kind == EventKind.POSITION_CHANGED && previousSizeOrZero() != 0 && netSizeOrZero() == 0;
    }

    /**
     * True when the absolute position grew or flipped sides. This is the check applied to
     * events that arrive while the account is locked out.
     */
    public boolean increasesExposure() {
        if (kind != EventKind.POSITION_CHANGED) {
            return false;
        }
        int previous = previousSizeOrZero();
        int current = netSizeOrZero();
        if (current == 0) {
            return false;
        }
        boolean flipped = previous != 0 && Integer.signum(previous) != Integer.signum(current);
        return flipped || Math.abs(current) > Math.abs(previous);
    }

    public boolean isStopOrder() {
        return kind == EventKind.ORDER_CHANGED
                && orderKind != null
                && orderKind.isStopType()
                && stopPrice != null;
    }
}
