package com.panwatch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the instrument_agents table.
 * A row exists only while the instrument is enrolled in the agent; blank/null columns inherit
 * the agent defaults.
 */
@Entity
@Table(
        name = "instrument_agents",
        uniqueConstraints = @UniqueConstraint(columnNames = {"instrument_id", "agent_name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InstrumentAgentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instrument_id", nullable = false)
    private Long instrumentId;

    @Column(name = "agent_name", nullable = false, length = 50)
    private String agentName;

    @Column(length = 100)
    private String schedule;

    @Column(name = "ai_model_id")
    private Long aiModelId;

    @Column(name = "notify_channel_ids", length = 500)
    private String notifyChannelIds;
}
