package com.yerin.notifyq.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.notifyq.domain.JobEventLog;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEventResponse(
        String eventType,
        Long durationMs,
        String message,
        Instant ts
) {
    public static JobEventResponse from(JobEventLog e) {
        return new JobEventResponse(e.getEventType(), e.getDurationMs(), e.getMessage(), e.getTs());
    }
}
