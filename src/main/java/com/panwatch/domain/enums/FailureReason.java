package com.panwatch.domain.enums;

public enum FailureReason {
    CONFIG_ERROR,
    DATA_UNAVAILABLE,
    ANALYSIS_ERROR,
    INTERNAL_ERROR
}
