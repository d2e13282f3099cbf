package com.panwatch.domain.enums;

/** Holding horizon the user declares for a position; quoted into prompts by label. */
public enum TradingStyle {
    SHORT("短线"),
    SWING("波段"),
    LONG("长线");

    private final String label;

    TradingStyle(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
