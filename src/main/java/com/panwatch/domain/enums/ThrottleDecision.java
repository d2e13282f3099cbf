package com.panwatch.domain.enums;

public enum ThrottleDecision {
    ALLOWED,
    THROTTLED
}
