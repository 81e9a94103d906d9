package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.JobCategory;
import lombok.Getter;

/**
 * 발송기가 실패를 돌려준 경우. 워커가 잡아서 브로커 재시도로 넘긴다.
 */
@Getter
public class NotificationSendException extends RuntimeException {
    private final JobCategory category;
    private final String jobKey;

    public NotificationSendException(JobCategory category, String jobKey, String error) {
        super("send failed category=" + category + ", key=" + jobKey + ", error=" + error);
        this.category = category;
        this.jobKey = jobKey;
    }
}
