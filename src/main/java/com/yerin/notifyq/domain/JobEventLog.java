package com.yerin.notifyq.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "notification_job_event", indexes = {
        @Index(name = "idx_job_event_key", columnList = "job_key"),
        @Index(name = "idx_job_event_ts", columnList = "ts")
})
public class JobEventLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="job_key", nullable=false, length=200)
    private String jobKey;

    @Column(length=60)
    private String category;

    @Column(name="entity_id", length=100)
    private String entityId;

    @Column(name="fund_id", length=100)
    private String fundId;

    @Column(name="event_type", nullable=false, length=50)
    private String eventType;

    @Column(name="duration_ms")
    private Long durationMs;

    @Column(columnDefinition = "text")
    private String message;

    @Column(name="ts", nullable=false)
    private Instant ts;

    @PrePersist void pre() { if (ts == null) ts = Instant.now(); }
}
