package com.panwatch.agent;

import com.panwatch.config.AnalysisProperties;
import com.panwatch.core.concurrent.BoundedCall;
import com.panwatch.domain.enums.AnalysisErrorKind;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.exception.AnalysisException;
import com.panwatch.exception.BaseException;
import com.panwatch.exception.ConfigException;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.AiModelMapper;
import com.panwatch.observability.AgentMetricsService;
import com.panwatch.observability.ExecutionTrail;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

/**
 * Calls the analysis provider of a model, bounded and retried.
 *
 * <ul>
 *   <li><b>Timeout</b>: each attempt is cancelled after {@code panwatch.analysis.timeout}</li>
 *   <li><b>Retry</b>: Resilience4j, {@code panwatch.analysis.max-attempts} attempts, only for
 *       transient kinds (TIMEOUT, RATE_LIMITED, UNAVAILABLE). INVALID_RESPONSE and PROVIDER_ERROR
 *       fail at once. A provider exception counts as UNAVAILABLE only when an I/O failure is
 *       in its cause chain.</li>
 * </ul>
 *
 * Every attempt writes a start entry and a success or error entry to the caller's trail.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final String TEST_SYSTEM_PROMPT = "You are a connectivity check. Reply with a short greeting.";
    static final String TEST_USER_PROMPT = "ping";

    private final AnalysisProviderRegistry analysisProviderRegistry;
    private final AnalysisProperties analysisProperties;
    private final AiModelJpaRepository aiModelJpaRepository;
    private final AiModelMapper aiModelMapper;
    private final Executor providerExecutor;
    private final AgentMetricsService agentMetricsService;
    private final Clock clock;

    public AnalysisService(
            AnalysisProviderRegistry analysisProviderRegistry,
            AnalysisProperties analysisProperties,
            AiModelJpaRepository aiModelJpaRepository,
            AiModelMapper aiModelMapper,
            @Qualifier("providerExecutor") Executor providerExecutor,
            AgentMetricsService agentMetricsService,
            Clock clock) {
        this.analysisProviderRegistry = analysisProviderRegistry;
        this.analysisProperties = analysisProperties;
        this.aiModelJpaRepository = aiModelJpaRepository;
        this.aiModelMapper = aiModelMapper;
        this.providerExecutor = providerExecutor;
        this.agentMetricsService = agentMetricsService;
        this.clock = clock;
    }

    /**
     * Runs the request against its model's provider.
     *
     * @throws ConfigException when no provider is registered for the model
     * @throws AnalysisException when every attempt failed or the response was invalid
     */
    public String analyze(AnalysisRequest request, ExecutionTrail trail) {
        AiModel model = request.getModel();
        AnalysisProvider provider = analysisProviderRegistry
                .find(model.getProviderId())
                .orElseThrow(() -> {
                    trail.error("model:" + model.label(), "No analysis provider registered for '"
                            + model.getProviderId() + "'", 0);
                    return new ConfigException("No analysis provider registered for '" + model.getProviderId() + "'");
                });

        Retry retry = Retry.of("analysis-" + model.label(), retryConfig());
        AtomicInteger attempt = new AtomicInteger();
        long started = System.currentTimeMillis();
        try {
            return Retry.decorateSupplier(retry, () -> attempt(provider, request, trail, attempt.incrementAndGet()))
                    .get();
        } finally {
            agentMetricsService.recordAnalysis(System.currentTimeMillis() - started);
        }
    }

    /** Sends a fixed prompt through the normal analysis path for the model "test" button. */
    public ConnectionTestResult testModel(Long aiModelId) {
        AiModel model = aiModelJpaRepository
                .findById(aiModelId)
                .map(aiModelMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("AiModel", aiModelId));

        ExecutionTrail trail = ExecutionTrail.newRun(clock);
        long started = System.currentTimeMillis();
        AnalysisRequest request = AnalysisRequest.builder()
                .model(model)
                .systemPrompt(TEST_SYSTEM_PROMPT)
                .userPrompt(TEST_USER_PROMPT)
                .build();
        try {
            analyze(request, trail);
            return ConnectionTestResult.builder()
                    .success(true)
                    .count(1)
                    .durationMs(System.currentTimeMillis() - started)
                    .logs(trail.entries())
                    .build();
        } catch (BaseException e) {
            return ConnectionTestResult.builder()
                    .success(false)
                    .durationMs(System.currentTimeMillis() - started)
                    .error(e.getMessage())
                    .logs(trail.entries())
                    .build();
        }
    }

    private RetryConfig retryConfig() {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, analysisProperties.getMaxAttempts()))
                .waitDuration(analysisProperties.getRetryWait())
                .retryOnException(e -> e instanceof AnalysisException ae && ae.isTransientFailure())
                .build();
    }

    private String attempt(AnalysisProvider provider, AnalysisRequest request, ExecutionTrail trail, int attemptNo) {
        String actor = "model:" + request.getModel().label();
        trail.start(actor, "Analyzing (attempt " + attemptNo + ")");
        long started = System.currentTimeMillis();
        long timeoutMs = analysisProperties.getTimeout().toMillis();

        BoundedCall<String> call;
        try {
            call = BoundedCall.submit(providerExecutor, () -> provider.analyze(request), analysisProperties.getTimeout());
        } catch (RejectedExecutionException e) {
            throw failed(trail, actor, started, new AnalysisException(
                    AnalysisErrorKind.UNAVAILABLE, "Rejected: provider pool is saturated", e));
        }
        try {
            String content = call.await();
            if (content == null || content.isBlank()) {
                throw new AnalysisException(AnalysisErrorKind.INVALID_RESPONSE, "Empty analysis response");
            }
            trail.success(actor, "Received " + content.length() + " chars", System.currentTimeMillis() - started, 1);
            return content;
        } catch (TimeoutException e) {
            throw failed(trail, actor, started, new AnalysisException(
                    AnalysisErrorKind.TIMEOUT, "Analysis timed out after " + timeoutMs + "ms", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw failed(trail, actor, started, classify(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(trail, actor, started, new AnalysisException(
                    AnalysisErrorKind.UNAVAILABLE, "Interrupted while waiting for analysis", e));
        } catch (AnalysisException e) {
            throw failed(trail, actor, started, e);
        }
    }

    /** Network-class causes are transient; anything else a provider throws is a bug and final. */
    private static AnalysisException classify(Throwable cause) {
        if (cause instanceof AnalysisException ae) {
            return ae;
        }
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof ResourceAccessException) {
                return new AnalysisException(
                        AnalysisErrorKind.UNAVAILABLE, "Analysis provider unreachable: " + describe(cause), cause);
            }
        }
        return new AnalysisException(AnalysisErrorKind.PROVIDER_ERROR, "Analysis provider error: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private AnalysisException failed(ExecutionTrail trail, String actor, long started, AnalysisException e) {
        trail.error(actor, e.getKind() + ": " + e.getMessage(), System.currentTimeMillis() - started);
        log.warn("Analysis attempt failed: actor={}, kind={}, message={}", actor, e.getKind(), e.getMessage());
        return e;
    }
}
