package com.yerin.notifyq.dto.response;

import com.yerin.notifyq.domain.JobCategory;
import com.yerin.notifyq.service.ScheduleResult;

import java.util.List;

public record ScheduleResponse(
        String entityId,
        boolean brokerAvailable,
        List<String> enqueued,
        List<String> skippedPast,
        List<String> failed
) {
    public static ScheduleResponse from(ScheduleResult r) {
        return new ScheduleResponse(
                r.entityId(),
                r.brokerAvailable(),
                r.enqueuedKeys(),
                r.skippedPast().stream().map(JobCategory::getWireName).toList(),
                r.failed().stream().map(JobCategory::getWireName).toList()
        );
    }
}
