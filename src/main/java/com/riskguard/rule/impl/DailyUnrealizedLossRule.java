package com.riskguard.rule.impl;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.Position;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.PnlThresholdParams;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Optional;

/**
 * Watches the combined floating P&L of all open positions.
 *
 * <p>In trade-by-trade mode the breaching position is closed without a lockout: the symbol of
 * the triggering event when it is still open, otherwise the worst open position. In
 * hard-lockout mode the account is flattened and locked until the next reset.
 */
public class DailyUnrealizedLossRule extends AbstractRiskRule {

    private final PnlThresholdParams params;

    public DailyUnrealizedLossRule(PnlThresholdParams params) {
        super(RuleKind.DAILY_UNREALIZED_LOSS, params.getCategory());
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED)) {
            return RuleVerdict.noBreach();
        }
        String accountId = event.getAccountId();
        BigDecimal total = context.getPositionBook().totalUnrealized(accountId);
        if (total.compareTo(params.getThreshold()) > 0) {
            return RuleVerdict.noBreach();
        }

        String reason = "Unrealized loss " + total.toPlainString() + " reached limit " + params.getThreshold().toPlainString();
        if (category() == EnforcementCategory.HARD_LOCKOUT) {
            return hardLockout(context.getResetScheduler().nextResetTime(context.getClock().instant()), true, reason);
        }

        Optional<Position> target = context.getPositionBook().get(accountId, event.getSymbol());
        if (target.isEmpty()) {
            target = context.getPositionBook().openPositions(accountId).stream()
                    .filter(p -> p.getUnrealizedPnl() != null)
                    .min(Comparator.comparing(Position::getUnrealizedPnl));
        }
        return target.map(position -> closeSymbol(position.getSymbol(), reason)).orElseGet(RuleVerdict::noBreach);
    }
}
