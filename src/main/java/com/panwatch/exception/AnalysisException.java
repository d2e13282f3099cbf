package com.panwatch.exception;

import com.panwatch.domain.enums.AnalysisErrorKind;

/**
 * Failure of the analysis step. {@link AnalysisErrorKind#isTransientFailure()} decides
 * whether the executor may retry.
 */
public class AnalysisException extends BaseException {

    private final AnalysisErrorKind kind;

    public AnalysisException(AnalysisErrorKind kind, String message) {
        super(ErrorCode.ANALYSIS_ERROR, message);
        this.kind = kind;
    }

    public AnalysisException(AnalysisErrorKind kind, String message, Throwable cause) {
        super(ErrorCode.ANALYSIS_ERROR, message, cause);
        this.kind = kind;
    }

    public AnalysisErrorKind getKind() {
        return kind;
    }

    public boolean isTransientFailure() {
        return kind.isTransientFailure();
    }
}
