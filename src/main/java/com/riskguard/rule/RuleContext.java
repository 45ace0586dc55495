package com.riskguard.rule;

import com.riskguard.calendar.ResetScheduler;
import com.riskguard.calendar.TradingCalendarService;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.pnl.TradeLog;
import com.riskguard.position.OpenOrderBook;
import com.riskguard.position.PositionBook;
import com.riskguard.timer.TimerManager;
import java.time.Clock;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Read access to engine state for rule evaluation. Rules reach every manager through this
 * context and never touch storage directly.
 */
@Component
@Getter
public class RuleContext {

    private final RealizedPnlAccumulator pnlAccumulator;
    private final LockoutManager lockoutManager;
    private final TimerManager timerManager;
    private final TradeLog tradeLog;
    private final PositionBook positionBook;
    private final OpenOrderBook openOrderBook;
    private final ResetScheduler resetScheduler;
    private final TradingCalendarService tradingCalendarService;
    private final Clock clock;

    public RuleContext(
            RealizedPnlAccumulator pnlAccumulator,
            LockoutManager lockoutManager,
            TimerManager timerManager,
            TradeLog tradeLog,
            PositionBook positionBook,
            OpenOrderBook openOrderBook,
            ResetScheduler resetScheduler,
            TradingCalendarService tradingCalendarService,
            Clock clock) {
        this.pnlAccumulator = pnlAccumulator;
        this.lockoutManager = lockoutManager;
        this.timerManager = timerManager;
        this.tradeLog = tradeLog;
        this.positionBook = positionBook;
        this.openOrderBook = openOrderBook;
        this.resetScheduler = resetScheduler;
        this.tradingCalendarService = tradingCalendarService;
        this.clock = clock;
    }
}
