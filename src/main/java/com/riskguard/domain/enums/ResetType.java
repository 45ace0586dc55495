package com.riskguard.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ResetType {
    DAILY("daily"),
    WEEKLY("weekly"),
    MANUAL("manual");

    private final String label;
}
