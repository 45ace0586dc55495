package com.riskguard.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last known position in one symbol. Quantity is signed: positive long, negative short.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String accountId;
    private String symbol;
    private int netSize;
    private BigDecimal averagePrice;
    private BigDecimal marketPrice;
    private BigDecimal unrealizedPnl;

    public boolean isLong() {
        return netSize > 0;
    }

    public String positionId() {
        return accountId + ":" + symbol;
    }
}
