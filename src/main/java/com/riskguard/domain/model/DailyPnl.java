package com.riskguard.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class DailyPnl {

    private final String accountId;
    private final LocalDate date;
    private final BigDecimal total;
    private final int tradeCount;

    public static DailyPnl empty(String accountId, LocalDate date) {
        return DailyPnl.builder()
                .accountId(accountId)
                .date(date)
                .total(BigDecimal.ZERO)
                .tradeCount(0)
                .build();
    }
}
