package com.yerin.notifyq.domain;

public enum RetryDecision {
    RETRY_SCHEDULED,
    EXHAUSTED,
    // 실행 중에 같은 키로 재예약되어 새 pending 작업이 우선한다
    SUPERSEDED
}
