package com.panwatch.notification;

import com.panwatch.core.concurrent.BoundedCall;
import com.panwatch.domain.enums.DispatchStatus;
import com.panwatch.domain.enums.ThrottleDecision;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.observability.AgentMetricsService;
import com.panwatch.observability.ExecutionTrail;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans one alert out to a set of channels, best effort.
 *
 * <p>Automatic sends pass the {@link ThrottleGate} first; a throttled dispatch attempts no
 * channel at all. Channels are sent concurrently on the notify pool, each bounded by
 * {@code panwatch.notification.timeout}; a send past its deadline is cancelled with an
 * interrupt, and a send the saturated pool rejects counts as a failed channel. One channel
 * failing never stops the others, and a dispatch never throws: failures are reported per
 * channel in the returned outcome.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ThrottleGate throttleGate;
    private final ChannelSenderRegistry channelSenderRegistry;
    private final Executor notifyExecutor;
    private final NotificationProperties notificationProperties;
    private final AgentMetricsService agentMetricsService;
    private final Clock clock;

    public NotificationDispatcher(
            ThrottleGate throttleGate,
            ChannelSenderRegistry channelSenderRegistry,
            @Qualifier("notifyExecutor") Executor notifyExecutor,
            NotificationProperties notificationProperties,
            AgentMetricsService agentMetricsService,
            Clock clock) {
        this.throttleGate = throttleGate;
        this.channelSenderRegistry = channelSenderRegistry;
        this.notifyExecutor = notifyExecutor;
        this.notificationProperties = notificationProperties;
        this.agentMetricsService = agentMetricsService;
        this.clock = clock;
    }

    public DispatchOutcome dispatch(Alert alert, List<NotifyChannel> channels, boolean bypass, ThrottleKey key) {
        return dispatch(alert, channels, bypass, key, LocalDateTime.now(clock));
    }

    /**
     * Testable version with an explicit throttle timestamp (the scheduler passes its tick time).
     */
    public DispatchOutcome dispatch(
            Alert alert, List<NotifyChannel> channels, boolean bypass, ThrottleKey key, LocalDateTime now) {
        return dispatch(alert, channels, bypass, key, now, null);
    }

    /**
     * @param minInterval throttle interval for this alert; null uses {@code panwatch.throttle.min-interval}
     */
    public DispatchOutcome dispatch(
            Alert alert,
            List<NotifyChannel> channels,
            boolean bypass,
            ThrottleKey key,
            LocalDateTime now,
            Duration minInterval) {
        ExecutionTrail trail = ExecutionTrail.newRun(clock);

        if (channels == null || channels.isEmpty()) {
            log.warn("No channels to notify for {}", key);
            return outcome(DispatchStatus.NO_CHANNELS, List.of(), trail);
        }

        if (!bypass && acquire(key, now, minInterval) == ThrottleDecision.THROTTLED) {
            agentMetricsService.recordThrottled();
            return outcome(DispatchStatus.THROTTLED, List.of(), trail);
        }

        List<PendingSend> pending =
                channels.stream().map(channel -> submit(alert, channel, trail)).toList();
        List<ChannelResult> results =
                pending.stream().map(send -> complete(send, trail)).toList();

        DispatchStatus status = DispatchOutcome.summarize(results);
        log.info("Dispatched alert '{}' for {}: {} ({} channels)", alert.getTitle(), key, status, results.size());
        return outcome(status, results, trail);
    }

    /**
     * Sends a synthetic alert to one channel, bypassing the throttle.
     * Used by the channel "test" button; never touches throttle state.
     */
    public ConnectionTestResult testChannel(NotifyChannel channel) {
        Alert alert = Alert.builder()
                .agentName("test")
                .title(notificationProperties.getTestTitle())
                .content(notificationProperties.getTestMessage())
                .timestamp(LocalDateTime.now(clock))
                .build();

        long started = System.currentTimeMillis();
        DispatchOutcome outcome = dispatch(alert, List.of(channel), true, null);
        ChannelResult result = outcome.getChannelResults().get(0);
        return ConnectionTestResult.builder()
                .success(result.isSuccess())
                .count(result.isSuccess() ? 1 : 0)
                .durationMs(System.currentTimeMillis() - started)
                .error(result.getError())
                .logs(outcome.getLogs())
                .build();
    }

    private ThrottleDecision acquire(ThrottleKey key, LocalDateTime now, Duration minInterval) {
        return minInterval != null
                ? throttleGate.tryAcquire(key, now, minInterval, false)
                : throttleGate.tryAcquire(key, now, false);
    }

    private PendingSend submit(Alert alert, NotifyChannel channel, ExecutionTrail trail) {
        trail.start(actor(channel), "Sending to " + channel.getType());
        long started = System.currentTimeMillis();
        try {
            BoundedCall<Void> call = BoundedCall.submit(
                    notifyExecutor,
                    () -> {
                        channelSenderRegistry.get(channel.getType()).send(channel, alert);
                        return null;
                    },
                    notificationProperties.getTimeout());
            return new PendingSend(channel, started, call, null);
        } catch (RejectedExecutionException e) {
            return new PendingSend(channel, started, null, "Rejected: notify pool is saturated");
        }
    }

    private ChannelResult complete(PendingSend send, ExecutionTrail trail) {
        String actor = actor(send.channel());
        String error = send.rejection();
        if (error == null) {
            try {
                send.call().await();
            } catch (TimeoutException e) {
                error = "Timed out after " + send.call().getTimeoutMs() + "ms";
            } catch (ExecutionException e) {
                error = describe(e.getCause() != null ? e.getCause() : e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = "Interrupted";
            }
        }

        long duration = System.currentTimeMillis() - send.started();
        if (error == null) {
            trail.success(actor, "Delivered", duration, 1);
            agentMetricsService.recordSent();
        } else {
            trail.error(actor, error, duration);
            agentMetricsService.recordSendFailure();
            log.warn("Channel {} failed: {}", actor, error);
        }
        return ChannelResult.builder()
                .channelId(send.channel().getId())
                .channelName(send.channel().getName())
                .success(error == null)
                .error(error)
                .durationMs(duration)
                .build();
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String actor(NotifyChannel channel) {
        return "channel:" + channel.getName();
    }

    private static DispatchOutcome outcome(DispatchStatus status, List<ChannelResult> results, ExecutionTrail trail) {
        return DispatchOutcome.builder()
                .status(status)
                .channelResults(results)
                .logs(trail.entries())
                .build();
    }

    /** A submitted send; {@code rejection} is set instead of {@code call} when the pool refused it. */
    private record PendingSend(NotifyChannel channel, long started, BoundedCall<Void> call, String rejection) {}
}
