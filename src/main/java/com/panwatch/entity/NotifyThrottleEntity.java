package com.panwatch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the notify_throttles table, one row per (agent, instrument). */
@Entity
@Table(
        name = "notify_throttles",
        uniqueConstraints = @UniqueConstraint(columnNames = {"agent_name", "instrument_key"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotifyThrottleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_name", nullable = false, length = 50)
    private String agentName;

    @Column(name = "instrument_key", nullable = false, length = 50)
    private String instrumentKey;

    @Column(name = "last_notified_at", nullable = false)
    private LocalDateTime lastNotifiedAt;

    @Column(name = "notify_count")
    private int notifyCount;
}
