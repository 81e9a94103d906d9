package com.yerin.notifyq.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 지연 작업 브로커 계약. 키 기준으로 pending 작업은 최대 하나만 존재한다.
 */
public interface DelayedJobQueue {

    /** 브로커가 구성되어 있지 않으면 false. 이 경우 호출자는 브로커를 부르지 않는다. */
    boolean isAvailable();

    /**
     * 같은 키의 pending 작업이 있으면 페이로드와 due 시각을 교체한다.
     *
     * @return 브로커 핸들(= key)
     */
    String enqueue(String key, JobPayload payload, long delayMillis);

    /** 실행 전 pending 작업을 제거했을 때만 true. */
    boolean cancel(String key);

    /** due 시각이 지난 작업을 lease 와 함께 가져간다. */
    List<ScheduledJob> pollDue(int max, String consumer);

    void complete(ScheduledJob job);

    RetryDecision fail(ScheduledJob job, Throwable error);

    /** lease 가 만료된 작업을 되돌리고, 시도 횟수를 다 쓴 작업을 반환한다. */
    List<ScheduledJob> requeueExpiredLeases();

    /** 감사 보관 기간이 지난 완료/실패 레코드를 지운다. */
    int purgeFinished(Instant completedBefore, int completedMax, Instant failedBefore);

    Optional<ScheduledJob> find(String key);

    long pendingCount();
}
