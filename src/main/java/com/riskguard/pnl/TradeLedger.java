package com.riskguard.pnl;

import com.riskguard.domain.model.RiskEvent;
import com.riskguard.exception.PersistenceException;
import java.math.BigDecimal;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Books an executed trade: the trade_records row and the daily_pnl update commit together
 * or not at all.
 *
 * <p>The trade id insert runs first, so a trade whose P&L write fails leaves no record
 * behind and a replay of the same fill is applied exactly once. In-memory state in
 * {@link TradeLog} is only updated after both writes succeeded.
 */
@Service
public class TradeLedger {

    private static final Logger log = LoggerFactory.getLogger(TradeLedger.class);

    private final TradeLog tradeLog;
    private final RealizedPnlAccumulator pnlAccumulator;

    public TradeLedger(TradeLog tradeLog, RealizedPnlAccumulator pnlAccumulator) {
        this.tradeLog = tradeLog;
        this.pnlAccumulator = pnlAccumulator;
    }

    /**
     * @return false if the trade id was already booked, in which case nothing changes
     * @throws PersistenceException if either write failed; the trade can be replayed
     */
    @Transactional
    public synchronized boolean book(RiskEvent trade) {
        String accountId = trade.getAccountId();
        if (tradeLog.isRecorded(accountId, trade.getEventId())) {
            log.info("stage=trade.duplicate account={} tradeId={}", accountId, trade.getEventId());
            return false;
        }
        Instant executedAt = tradeLog.insert(trade);
        if (trade.getRealizedPnl() != null) {
            BigDecimal total = pnlAccumulator.addTrade(accountId, trade.getRealizedPnl());
            log.debug("stage=trade.booked account={} tradeId={} total={}", accountId, trade.getEventId(), total);
        }
        tradeLog.remember(accountId, trade.getEventId(), executedAt);
        return true;
    }
}
