package com.openforge.devgauge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Per-user plan and rolling usage counters (logical path users/{id}.usage).
 * Counters reset when {@code periodStart} is older than the metering window.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "user_usage",
    uniqueConstraints = @UniqueConstraint(name = "uq_usage_user", columnNames = "user_id")
)
public class UsageRecord extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    /** Only changed server-side; callers never choose their own plan. */
    @Builder.Default
    @Column(name = "plan_id", nullable = false, length = 32)
    private String planId = "free";

    @Builder.Default
    @Column(name = "messages", nullable = false)
    private Integer messages = 0;

    @Builder.Default
    @Column(name = "reanalyzes", nullable = false)
    private Integer reanalyzes = 0;

    @Builder.Default
    @Column(name = "project_chats", nullable = false)
    private Integer projectChats = 0;

    @Column(name = "period_start", nullable = false)
    private Instant periodStart;
}
