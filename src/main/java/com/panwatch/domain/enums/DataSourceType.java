package com.panwatch.domain.enums;

/** Data capability a provider binding serves. */
public enum DataSourceType {
    NEWS,
    KLINE,
    CAPITAL_FLOW,
    QUOTE,
    CHART
}
