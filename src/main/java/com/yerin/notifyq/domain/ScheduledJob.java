package com.yerin.notifyq.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 브로커가 보관하는 작업 한 건의 뷰. attempts 는 이번 전달까지 포함한 시도 횟수다.
 * claim 은 브로커가 전달마다 새로 발급하는 토큰이며, complete/fail 은 최신 전달의 토큰일 때만 상태를 바꾼다.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ScheduledJob {
    private final String key;
    private final JobPayload payload;
    private final Instant dueAt;
    private final int attempts;
    private final JobStatus status;
    private final Instant leaseUntil;
    private final String lastError;
    private final long claim;

    public String category() {
        return payload == null ? null : payload.category();
    }

    public String entityId() {
        return payload == null ? null : payload.entityId();
    }

    public String fundId() {
        return payload == null ? null : payload.fundId();
    }
}
