package com.riskguard.exception;

import java.util.Map;

/**
 * Invalid rule configuration. Thrown while the rule set is built, which aborts startup.
 */
public class ConfigException extends BaseException {

    public ConfigException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public ConfigException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIG_ERROR, message, details);
    }
}
