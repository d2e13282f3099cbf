package com.panwatch.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    CONFIG_ERROR("CONFIG_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    ANALYSIS_ERROR("ANALYSIS_ERROR", 502),
    CHANNEL_ERROR("CHANNEL_ERROR", 502),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
