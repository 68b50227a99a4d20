package com.openforge.devgauge.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Persisted agent state, one row per user (logical path users/{id}/agent/state).
 *
 *  memoryJson  : serialized List<MemoryItem>, already capped for the plan
 *  identityJson: serialized AgentIdentity; null when the plan has no custom identity
 *
 * Created lazily on the first eligible write; removed only by an account wipe.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "agent_states",
    uniqueConstraints = @UniqueConstraint(name = "uq_agent_state_user", columnNames = "user_id")
)
public class AgentStateRecord extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "memory_json", columnDefinition = "LONGTEXT")
    private String memoryJson;

    @Builder.Default
    @Column(name = "memory_enabled", nullable = false)
    private Boolean memoryEnabled = Boolean.TRUE;

    @Column(name = "identity_json", columnDefinition = "TEXT")
    private String identityJson;
}
