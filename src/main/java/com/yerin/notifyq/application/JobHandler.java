package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.JobCategory;
import com.yerin.notifyq.domain.ScheduledJob;

import java.util.Set;

public interface JobHandler {
    /** 이 핸들러가 처리하는 카테고리. 카테고리는 핸들러 하나에만 속한다. */
    Set<JobCategory> categories();

    /** 발송 실패는 예외로 알린다. 건너뛰기는 정상 종료다. */
    HandlerOutcome handle(ScheduledJob job);
}
