package com.panwatch.agent;

/**
 * An AI backend, registered as a Spring bean and selected by {@code AiModel.providerId}.
 *
 * <p>Implementations throw {@link com.panwatch.exception.AnalysisException} with a kind that
 * says whether the failure is worth retrying: TIMEOUT, RATE_LIMITED and UNAVAILABLE are;
 * INVALID_RESPONSE is not. Any other exception is UNAVAILABLE when an {@code IOException} or
 * {@code ResourceAccessException} is in its cause chain and PROVIDER_ERROR (not retried) otherwise.
 */
public interface AnalysisProvider {

    String providerId();

    /** Returns the raw model output text. */
    String analyze(AnalysisRequest request);
}
