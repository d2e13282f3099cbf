package com.panwatch.observability;

import com.panwatch.domain.enums.ExecutionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Engine meters.
 * <ul>
 *   <li><b>agent.runs</b> (counter, tag outcome=done|failed)</li>
 *   <li><b>notifications.sent</b> / <b>notifications.failed</b> (counters, per channel attempt)</li>
 *   <li><b>notifications.throttled</b> (counter, per suppressed dispatch)</li>
 *   <li><b>datasource.fallbacks</b> (counter, provider attempts that failed over)</li>
 *   <li><b>analysis.latency</b> (timer)</li>
 * </ul>
 */
@Service
public class AgentMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter notificationsSent;
    private final Counter notificationsFailed;
    private final Counter notificationsThrottled;
    private final Counter dataSourceFallbacks;
    private final Timer analysisLatency;

    public AgentMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.notificationsSent = Counter.builder("notifications.sent")
                .description("Channel sends that succeeded")
                .register(meterRegistry);
        this.notificationsFailed = Counter.builder("notifications.failed")
                .description("Channel sends that failed or timed out")
                .register(meterRegistry);
        this.notificationsThrottled = Counter.builder("notifications.throttled")
                .description("Automatic dispatches suppressed by the throttle")
                .register(meterRegistry);
        this.dataSourceFallbacks = Counter.builder("datasource.fallbacks")
                .description("Failed provider attempts that moved on to the next binding")
                .register(meterRegistry);
        this.analysisLatency = Timer.builder("analysis.latency")
                .description("Analysis provider call latency including retries")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(3))
                .register(meterRegistry);
    }

    public void recordRun(ExecutionState finalState) {
        String outcome = finalState == ExecutionState.DONE ? "done" : "failed";
        meterRegistry.counter("agent.runs", "outcome", outcome).increment();
    }

    public void recordSent() {
        notificationsSent.increment();
    }

    public void recordSendFailure() {
        notificationsFailed.increment();
    }

    public void recordThrottled() {
        notificationsThrottled.increment();
    }

    public void recordFallback() {
        dataSourceFallbacks.increment();
    }

    public void recordAnalysis(long durationMs) {
        analysisLatency.record(durationMs, TimeUnit.MILLISECONDS);
    }
}
