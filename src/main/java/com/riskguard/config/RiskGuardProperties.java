package com.riskguard.config;

import com.riskguard.rule.RuleSpec;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Top-level engine configuration under the {@code riskguard} prefix.
 *
 * <p>{@code rules} maps a rule kind's config name (e.g. {@code daily-realized-loss}) to its
 * raw parameters. The map is validated into typed parameter objects by
 * {@link com.riskguard.rule.RuleSetFactory}; the engine never reads these raw values directly.
 */
@Configuration
@ConfigurationProperties(prefix = "riskguard")
@Getter
@Setter
public class RiskGuardProperties {

    /** The single account this instance protects. */
    private String accountId;

    private Map<String, RuleSpec> rules = new LinkedHashMap<>();
}
