package com.panwatch.entity;

import com.panwatch.domain.enums.ExecutionState;
import com.panwatch.domain.enums.FailureReason;
import com.panwatch.domain.enums.SuggestionAction;
import com.panwatch.domain.enums.TriggerSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the agent_runs table: one row per finished execution. */
@Entity
@Table(name = "agent_runs", indexes = @Index(name = "idx_agent_runs_agent", columnList = "agent_name"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 40)
    private String runId;

    @Column(name = "agent_name", nullable = false, length = 50)
    private String agentName;

    @Column(name = "instrument_id")
    private Long instrumentId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TriggerSource trigger;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ExecutionState status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 30)
    private FailureReason failureReason;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private SuggestionAction action;

    @Column(name = "should_alert")
    private boolean shouldAlert;

    private boolean notified;

    @Column(length = 8000)
    private String content;

    @Column(length = 2000)
    private String error;

    @Column(name = "duration_ms")
    private long durationMs;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
