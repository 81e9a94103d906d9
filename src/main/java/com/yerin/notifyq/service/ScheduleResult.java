package com.yerin.notifyq.service;

import com.yerin.notifyq.domain.JobCategory;

import java.util.List;

/**
 * 스케줄 호출 한 번의 결과. 브로커 실패는 예외 대신 failed 로 보고된다.
 */
public record ScheduleResult(
        String entityId,
        boolean brokerAvailable,
        List<String> enqueuedKeys,
        List<JobCategory> skippedPast,
        List<JobCategory> failed
) {
    public ScheduleResult {
        enqueuedKeys = List.copyOf(enqueuedKeys);
        skippedPast = List.copyOf(skippedPast);
        failed = List.copyOf(failed);
    }

    public static ScheduleResult unavailable(String entityId) {
        return new ScheduleResult(entityId, false, List.of(), List.of(), List.of());
    }

    public int enqueuedCount() {
        return enqueuedKeys.size();
    }
}
