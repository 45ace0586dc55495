package com.riskguard.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange holidays, bound from {@code riskguard.calendar.holidays}:
 *
 * <pre>
 * riskguard:
 *   calendar:
 *     holidays:
 *       - date: 2026-04-03
 *         name: Good Friday
 * </pre>
 *
 * A holiday suppresses the daily reset and, when the session rule asks for it, blocks trading
 * for the whole day.
 */
@Data
@Component
@ConfigurationProperties(prefix = "riskguard.calendar")
public class HolidayCalendarConfig {

    private List<Holiday> holidays = new ArrayList<>();

    /** Holiday names keyed by date; entries without a date are ignored, the first entry per date wins. */
    public Map<LocalDate, String> byDate() {
        Map<LocalDate, String> byDate = new LinkedHashMap<>();
        for (Holiday holiday : holidays) {
            if (holiday.getDate() != null) {
                byDate.putIfAbsent(holiday.getDate(), holiday.getName() != null ? holiday.getName() : "Holiday");
            }
        }
        return byDate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Holiday {
        private LocalDate date;
        private String name;
    }
}
