package com.panwatch.api.dto.response;

import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.exception.ErrorCode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope. {@code logs} is filled when the failure carries an execution trail
 * (for example every data provider failing), so partial progress stays visible to the caller.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return of(errorCode, message, details, path, List.of());
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode,
            String message,
            Map<String, Object> details,
            String path,
            List<ExecutionLogEntry> logs) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .logs(logs)
                .build();
        return new ApiErrorResponse(errorDetail);
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
        private final List<ExecutionLogEntry> logs;
    }
}
