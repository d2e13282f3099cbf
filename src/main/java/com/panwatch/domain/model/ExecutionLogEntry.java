package com.panwatch.domain.model;

import com.panwatch.domain.enums.LogPhase;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One line of an execution trail. Immutable once created; trails are append-only.
 *
 * <p>{@code actor} is the provider, channel, model or agent that produced the entry.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ExecutionLogEntry {

    private final LocalDateTime timestamp;
    private final String actor;
    private final LogPhase phase;
    private final String message;
    private final long durationMs;
    private final int count;
}
