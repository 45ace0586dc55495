package com.riskguard.domain.enums;

/**
 * Order lifecycle status. OPEN and PENDING are working orders; the rest are terminal.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    FILLED,
    CANCELLED,
    EXPIRED,
    REJECTED,
    UNKNOWN;

    public boolean isWorking() {
        return this == OPEN || this == PENDING;
    }

    public static OrderStatus fromBrokerCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code) {
            case 1 -> OPEN;
            case 2 -> FILLED;
            case 3 -> CANCELLED;
            case 4 -> EXPIRED;
            case 5 -> REJECTED;
            case 6 -> PENDING;
            default -> UNKNOWN;
        };
    }
}
