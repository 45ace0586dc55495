package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.TradeManagementParams;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Places an initial stop on new positions and trails it behind the best price seen.
 *
 * <p>Unlike the other rules this one remembers, per open position, the best price and the last
 * stop it issued, so that a stop only ever moves in the position's favour. The memory is
 * dropped when the position goes flat.
 */
public class TradeManagementRule extends AbstractRiskRule {

    private final TradeManagementParams params;
    private final Map<String, StopState> states = new ConcurrentHashMap<>();

    public TradeManagementRule(TradeManagementParams params) {
        super(RuleKind.TRADE_MANAGEMENT, EnforcementCategory.AUTOMATION);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED)) {
            return RuleVerdict.noBreach();
        }
        String key = event.getAccountId() + ":" + event.getSymbol();
        if (event.netSizeOrZero() == 0) {
            states.remove(key);
            return RuleVerdict.noBreach();
        }

        boolean isLong = event.netSizeOrZero() > 0;
        BigDecimal tick = params.tickSizeFor(event.getSymbol());

        if (event.opensPosition() || !states.containsKey(key)) {
            BigDecimal entry = event.getAveragePrice();
            if (entry == null) {
                return RuleVerdict.noBreach();
            }
            StopState state = new StopState(isLong, entry, null);
            states.put(key, state);
            if (params.getStopLossTicks() != null) {
                BigDecimal stop = offset(entry, params.getStopLossTicks(), tick, isLong);
                state.lastStop = stop;
                return modifyStop(event.getSymbol(), stop,
                        "Initial stop " + params.getStopLossTicks() + " ticks from entry " + entry.toPlainString());
            }
            return RuleVerdict.noBreach();
        }

        StopState state = states.get(key);
        if (state.isLong != isLong) {
            states.remove(key);
            return RuleVerdict.noBreach();
        }
        BigDecimal price = event.getMarketPrice();
        if (params.getTrailingTicks() == null || price == null) {
            return RuleVerdict.noBreach();
        }
        boolean newExtreme = isLong ? price.compareTo(state.bestPrice) > 0 : price.compareTo(state.bestPrice) < 0;
        if (!newExtreme) {
            return RuleVerdict.noBreach();
        }
        state.bestPrice = price;
        BigDecimal candidate = offset(price, params.getTrailingTicks(), tick, isLong);
        boolean improves = state.lastStop == null
                || (isLong ? candidate.compareTo(state.lastStop) > 0 : candidate.compareTo(state.lastStop) < 0);
        if (!improves) {
            return RuleVerdict.noBreach();
        }
        state.lastStop = candidate;
        return modifyStop(event.getSymbol(), candidate,
                "Trailing stop " + params.getTrailingTicks() + " ticks behind " + price.toPlainString());
    }

    private static BigDecimal offset(BigDecimal price, int ticks, BigDecimal tickSize, boolean isLong) {
        BigDecimal distance = tickSize.multiply(BigDecimal.valueOf(ticks));
        return isLong ? price.subtract(distance) : price.add(distance);
    }

    private static final class StopState {

        private final boolean isLong;
        private BigDecimal bestPrice;
        private BigDecimal lastStop;

        private StopState(boolean isLong, BigDecimal bestPrice, BigDecimal lastStop) {
            this.isLong = isLong;
            this.bestPrice = bestPrice;
            this.lastStop = lastStop;
        }
    }
}
