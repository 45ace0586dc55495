package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Allowed trading window. When {@code end} is before {@code start} the window spans midnight.
 */
@Getter
@Builder
@ToString
public class SessionParams {

    private static final RuleKind KIND = RuleKind.SESSION_BLOCK_OUTSIDE;

    private final LocalTime start;
    private final LocalTime end;
    private final ZoneId zoneId;
    private final boolean blockWeekends;
    private final boolean blockHolidays;

    public boolean isWithinWindow(LocalTime time) {
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    public static SessionParams from(RuleSpec spec) {
        LocalTime start = parseTime("start", spec.getStart());
        LocalTime end = parseTime("end", spec.getEnd());
        if (start.equals(end)) {
            throw ParamValidation.invalid(KIND, "end", "must differ from start");
        }
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(spec.getTimezone() != null ? spec.getTimezone() : "America/New_York");
        } catch (DateTimeException e) {
            throw ParamValidation.invalid(KIND, "timezone", "is not a valid zone: " + spec.getTimezone());
        }
        return SessionParams.builder()
                .start(start)
                .end(end)
                .zoneId(zoneId)
                .blockWeekends(spec.getBlockWeekends() == null || spec.getBlockWeekends())
                .blockHolidays(spec.getBlockHolidays() == null || spec.getBlockHolidays())
                .build();
    }

    private static LocalTime parseTime(String field, String value) {
        ParamValidation.required(KIND, field, value);
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ParamValidation.invalid(KIND, field, "is not a HH:mm time: " + value);
        }
    }
}
