package com.panwatch.domain.enums;

/**
 * Failure classes of the analysis provider.
 * Transient kinds are retried with a small fixed bound. INVALID_RESPONSE and PROVIDER_ERROR
 * (a provider bug rather than a network problem) never are.
 */
public enum AnalysisErrorKind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    UNAVAILABLE(true),
    INVALID_RESPONSE(false),
    PROVIDER_ERROR(false);

    private final boolean transientFailure;

    AnalysisErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
