package com.riskguard.domain.enums;

/**
 * NET sums signed sizes across instruments (a long and a short offset each other).
 * GROSS sums absolute sizes.
 */
public enum PositionMode {
    NET,
    GROSS
}
