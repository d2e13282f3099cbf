package com.panwatch.observability;

import com.panwatch.domain.enums.LogPhase;
import com.panwatch.domain.model.ExecutionLogEntry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only log trail of one run (or one connection test).
 *
 * <p>Safe for concurrent appends: channel sends of one dispatch write into the same trail
 * from the notify pool. Entries are never modified or removed.
 */
public class ExecutionTrail {

    private final String runId;
    private final Clock clock;
    private final List<ExecutionLogEntry> entries = new ArrayList<>();

    public ExecutionTrail(String runId, Clock clock) {
        this.runId = runId;
        this.clock = clock;
    }

    public static ExecutionTrail newRun(Clock clock) {
        return new ExecutionTrail(UUID.randomUUID().toString(), clock);
    }

    public String getRunId() {
        return runId;
    }

    public ExecutionLogEntry start(String actor, String message) {
        return append(actor, LogPhase.START, message, 0, 0);
    }

    public ExecutionLogEntry success(String actor, String message, long durationMs, int count) {
        return append(actor, LogPhase.SUCCESS, message, durationMs, count);
    }

    public ExecutionLogEntry error(String actor, String message, long durationMs) {
        return append(actor, LogPhase.ERROR, message, durationMs, 0);
    }

    private ExecutionLogEntry append(String actor, LogPhase phase, String message, long durationMs, int count) {
        ExecutionLogEntry entry = ExecutionLogEntry.builder()
                .timestamp(LocalDateTime.now(clock))
                .actor(actor)
                .phase(phase)
                .message(message)
                .durationMs(durationMs)
                .count(count)
                .build();
        synchronized (entries) {
            entries.add(entry);
        }
        return entry;
    }

    /** Copies entries recorded elsewhere (e.g. a router sub-trail) onto the end of this trail. */
    public void appendAll(List<ExecutionLogEntry> others) {
        synchronized (entries) {
            entries.addAll(others);
        }
    }

    /** Snapshot in append order. */
    public List<ExecutionLogEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
