package com.riskguard.rule;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.PositionMode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Raw, unvalidated parameters of one configured rule, as bound from {@code riskguard.rules.<kind>}.
 *
 * <p>This is the union of every rule kind's settings; each kind reads only its own fields.
 * {@link RuleSetFactory} turns it into the kind's typed parameter object and rejects
 * anything out of range.
 */
@Data
public class RuleSpec {

    private boolean enabled = true;
    private EnforcementCategory category;

    // P&L thresholds
    private BigDecimal limit;
    private BigDecimal target;

    // Position limits
    private Integer maxContracts;
    private PositionMode mode;
    private Map<String, Integer> limits = new LinkedHashMap<>();
    private String enforcement;
    private String unknownSymbolAction;

    // Trade frequency
    private Integer perMinute;
    private Integer perHour;
    private Integer perSession;
    private Long cooldownMinuteSeconds;
    private Long cooldownHourSeconds;
    private Long cooldownSessionSeconds;

    // Cooldown after loss
    private List<Tier> tiers = new ArrayList<>();
    private Boolean flatten;

    // Stop-loss grace
    private Long graceSeconds;

    // Session window
    private String start;
    private String end;
    private String timezone;
    private Boolean blockWeekends;
    private Boolean blockHolidays;

    // Symbol blocks
    private List<String> blockedSymbols = new ArrayList<>();

    // Trade management
    private Integer stopLossTicks;
    private Integer trailingTicks;
    private Map<String, BigDecimal> tickSizes = new LinkedHashMap<>();
    private BigDecimal defaultTickSize;

    /**
     * One loss tier: a trade losing at least {@code lossAmount} (negative) triggers a cooldown
     * of {@code cooldownSeconds}.
     */
    @Data
    public static class Tier {

        private BigDecimal lossAmount;
        private Long cooldownSeconds;
    }
}
