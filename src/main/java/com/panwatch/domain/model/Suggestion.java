package com.panwatch.domain.model;

import com.panwatch.domain.enums.SuggestionAction;
import lombok.Builder;
import lombok.Value;

/** Classified analysis output for one instrument (or for a whole batch). */
@Value
@Builder
public class Suggestion {

    SuggestionAction action;
    boolean shouldAlert;
    String reason;
    String raw;

    public static Suggestion watch(String raw) {
        return new Suggestion(SuggestionAction.WATCH, false, null, raw);
    }
}
