package com.riskguard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retry, timeout and shutdown settings for broker enforcement calls.
 * Properties are read from the {@code riskguard.enforcement} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "riskguard.enforcement")
@Getter
@Setter
public class EnforcementConfig {

    /** Attempts per broker call, including the first. */
    private int maxRetries = 3;

    /** Backoff before the second attempt; doubles on each further attempt. */
    private long initialBackoffMs = 500;

    /** Upper bound for a single broker call attempt. */
    private long callTimeoutMs = 5000;

    /** How long graceful shutdown waits for in-flight enforcement. */
    private long shutdownTimeoutMs = 15000;

    /** Worker threads that run enforcement off the event loop. */
    private int workerThreads = 4;
}
