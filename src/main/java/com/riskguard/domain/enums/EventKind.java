package com.riskguard.domain.enums;

/**
 * Internal event vocabulary. Every broker-native event shape is normalized into one of these.
 */
public enum EventKind {
    TRADE_EXECUTED,
    POSITION_CHANGED,
    ORDER_CHANGED,
    ACCOUNT_STATUS_CHANGED
}
