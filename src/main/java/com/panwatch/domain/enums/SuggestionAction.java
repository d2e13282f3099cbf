package com.panwatch.domain.enums;

/**
 * Fixed action taxonomy an analysis result is classified into.
 * BUY/ADD/REDUCE/SELL are actionable and alert by default; HOLD/WATCH do not.
 */
public enum SuggestionAction {
    BUY("买入", true),
    ADD("加仓", true),
    REDUCE("减仓", true),
    SELL("卖出", true),
    HOLD("持有", false),
    WATCH("观望", false);

    private final String label;
    private final boolean actionable;

    SuggestionAction(String label, boolean actionable) {
        this.label = label;
        this.actionable = actionable;
    }

    public String getLabel() {
        return label;
    }

    public boolean isActionable() {
        return actionable;
    }
}
