package com.panwatch.entity;

import com.panwatch.domain.enums.ExecutionMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the agent_configs table.
 * One row per built-in agent, seeded at startup; list and map fields are stored as JSON text.
 */
@Entity
@Table(name = "agent_configs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentConfigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String name;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(length = 500)
    private String description;

    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_mode", nullable = false, length = 20)
    private ExecutionMode executionMode;

    @Column(length = 100)
    private String schedule;

    @Column(name = "ai_model_id")
    private Long aiModelId;

    /** JSON array of channel ids, e.g. "[1,3]". */
    @Column(name = "notify_channel_ids", length = 500)
    private String notifyChannelIds;

    /** JSON object of agent parameters. */
    @Column(length = 4000)
    private String config;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
