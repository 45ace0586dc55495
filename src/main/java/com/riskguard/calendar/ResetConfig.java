package com.riskguard.calendar;

import java.time.DayOfWeek;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Daily (and optional weekly) reset boundary, read from the {@code riskguard.reset} prefix.
 * Times are HH:mm in {@link #timezone}.
 */
@Configuration
@ConfigurationProperties(prefix = "riskguard.reset")
@Getter
@Setter
public class ResetConfig {

    private String time = "17:00";

    private String timezone = "America/New_York";

    /** Day of the optional weekly reset. Null disables it. */
    private DayOfWeek weeklyDay;

    /** Time of the weekly reset; defaults to {@link #time} when unset. */
    private String weeklyTime;
}
