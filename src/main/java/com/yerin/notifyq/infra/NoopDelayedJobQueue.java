package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.domain.JobPayload;
import com.yerin.notifyq.domain.RetryDecision;
import com.yerin.notifyq.domain.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 브로커 연결 문자열이 없을 때 쓰는 구현. 비즈니스 동작이 알림 백엔드 때문에 실패하지 않도록
 * 모든 호출은 경고만 남기고 성공/false 를 돌려준다.
 */
@Slf4j
public class NoopDelayedJobQueue implements DelayedJobQueue {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String enqueue(String key, JobPayload payload, long delayMillis) {
        log.warn("[NoopQueue] broker not configured, dropped enqueue key={}", key);
        return key;
    }

    @Override
    public boolean cancel(String key) {
        log.warn("[NoopQueue] broker not configured, ignored cancel key={}", key);
        return false;
    }

    @Override
    public List<ScheduledJob> pollDue(int max, String consumer) {
        return List.of();
    }

    @Override
    public void complete(ScheduledJob job) {
    }

    @Override
    public RetryDecision fail(ScheduledJob job, Throwable error) {
        return RetryDecision.EXHAUSTED;
    }

    @Override
    public List<ScheduledJob> requeueExpiredLeases() {
        return List.of();
    }

    @Override
    public int purgeFinished(Instant completedBefore, int completedMax, Instant failedBefore) {
        return 0;
    }

    @Override
    public Optional<ScheduledJob> find(String key) {
        return Optional.empty();
    }

    @Override
    public long pendingCount() {
        return 0;
    }
}
