package com.panwatch.entity;

import com.panwatch.domain.enums.LogPhase;
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

/** JPA entity for the append-only execution_logs table. Rows are never updated. */
@Entity
@Table(name = "execution_logs", indexes = @Index(name = "idx_execution_logs_run", columnList = "run_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 40)
    private String runId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(length = 100)
    private String actor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LogPhase phase;

    @Column(length = 2000)
    private String message;

    @Column(name = "duration_ms")
    private long durationMs;

    @Column(name = "item_count")
    private int count;
}
