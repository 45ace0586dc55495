package com.riskguard.pnl;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Lifetime realized P&L summary across all tracked days for one account.
 */
@Data
@Builder
public class PnlStats {

    private String accountId;
    private BigDecimal totalPnl;
    private int totalTrades;
    private int daysTracked;
    private LocalDate bestDay;
    private BigDecimal bestDayPnl;
    private LocalDate worstDay;
    private BigDecimal worstDayPnl;
}
