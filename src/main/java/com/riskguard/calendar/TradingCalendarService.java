package com.riskguard.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holiday and weekend lookups for the reset scheduler and the session rule.
 *
 * <p>Holidays come from {@link HolidayCalendarConfig} and are fixed at startup. Weekends are
 * reported separately from holidays: the reset scheduler only skips configured holidays,
 * while the session rule decides on its own whether weekends are blocked.
 */
@Service
public class TradingCalendarService {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendarService.class);

    private final Map<LocalDate, String> holidays;

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidays = Map.copyOf(holidayCalendarConfig.byDate());
        log.info("Trading calendar loaded with {} holidays", holidays.size());
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.containsKey(date);
    }

    public Optional<String> holidayName(LocalDate date) {
        return Optional.ofNullable(holidays.get(date));
    }

    public boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * First date on or after {@code from} that the predicate accepts, searching at most a year ahead.
     */
    public LocalDate firstMatching(LocalDate from, Predicate<LocalDate> accept) {
        LocalDate candidate = from;
        for (int i = 0; i < 366; i++) {
            if (accept.test(candidate)) {
                return candidate;
            }
            candidate = candidate.plusDays(1);
        }
        throw new IllegalStateException("No acceptable calendar date within a year of " + from);
    }
}
