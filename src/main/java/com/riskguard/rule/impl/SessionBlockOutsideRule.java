package com.riskguard.rule.impl;

import com.riskguard.calendar.TradingCalendarService;
import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.rule.AbstractRiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.params.SessionParams;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * Blocks new exposure outside the allowed session window, on weekends and on holidays. A
 * breach flattens the account and locks it until the next session opens.
 */
public class SessionBlockOutsideRule extends AbstractRiskRule {

    private final SessionParams params;

    public SessionBlockOutsideRule(SessionParams params) {
        super(RuleKind.SESSION_BLOCK_OUTSIDE, EnforcementCategory.HARD_LOCKOUT);
        this.params = params;
    }

    @Override
    public RuleVerdict evaluate(RiskEvent event, RuleContext context) {
        if (!event.is(EventKind.POSITION_CHANGED) || !event.increasesExposure()) {
            return RuleVerdict.noBreach();
        }
        TradingCalendarService calendar = context.getTradingCalendarService();
        ZonedDateTime now = context.getClock().instant().atZone(params.getZoneId());
        LocalDate today = now.toLocalDate();

        String reason;
        if (params.isBlockHolidays() && calendar.isHoliday(today)) {
            reason = "Trading on holiday " + calendar.holidayName(today).orElse(today.toString());
        } else if (params.isBlockWeekends() && calendar.isWeekend(today)) {
            reason = "Trading on weekend " + today.getDayOfWeek();
        } else if (!params.isWithinWindow(now.toLocalTime())) {
            reason = String.format("Trading at %s outside session %s-%s %s",
                    now.toLocalTime().withNano(0), params.getStart(), params.getEnd(), params.getZoneId());
        } else {
            return RuleVerdict.noBreach();
        }
        return hardLockout(nextSessionStart(now, calendar), false, reason);
    }

    /** Next instant at which the session window opens on an allowed day. */
    Instant nextSessionStart(ZonedDateTime now, TradingCalendarService calendar) {
        LocalDate from = now.toLocalTime().isBefore(params.getStart()) ? now.toLocalDate() : now.toLocalDate().plusDays(1);
        LocalDate day = calendar.firstMatching(from, date ->
                !(params.isBlockHolidays() && calendar.isHoliday(date))
                        && !(params.isBlockWeekends() && calendar.isWeekend(date)));
        return ZonedDateTime.of(day, params.getStart(), params.getZoneId()).toInstant();
    }
}
