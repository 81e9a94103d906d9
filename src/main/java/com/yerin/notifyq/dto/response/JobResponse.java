package com.yerin.notifyq.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.notifyq.domain.JobStatus;
import com.yerin.notifyq.domain.ScheduledJob;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String key,
        String category,
        String entityId,
        String fundId,
        JobStatus status,
        Integer attempts,
        Instant dueAt,
        Instant leaseUntil,
        Instant anchorAt,
        String lastError,
        Map<String, String> metadata
) {
    public static JobResponse from(ScheduledJob j) {
        return new JobResponse(
                j.getKey(),
                j.category(),
                j.entityId(),
                j.fundId(),
                j.getStatus(),
                j.getAttempts(),
                j.getDueAt(),
                j.getLeaseUntil(),
                j.getPayload() == null ? null : j.getPayload().anchorAt(),
                j.getLastError(),
                j.getPayload() == null ? null : j.getPayload().metadata()
        );
    }
}
