package com.panwatch.exception;

import java.util.Map;

public class InvalidScheduleException extends ConfigException {

    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super(
                String.format("Invalid schedule '%s': %s", expression, reason),
                Map.of("schedule", expression == null ? "" : expression));
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
