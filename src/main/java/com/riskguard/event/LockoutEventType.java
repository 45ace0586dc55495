package com.riskguard.event;

public enum LockoutEventType {
    SET,
    CLEARED
}
