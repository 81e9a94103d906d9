package com.yerin.notifyq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    JOB_NOT_EXHAUSTED(HttpStatus.BAD_REQUEST, "재시도를 모두 소진한 작업만 재실행할 수 있습니다.", "JOB-002"),
    QUEUE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "알림 브로커가 구성되어 있지 않습니다.", "JOB-003"),
    UNKNOWN_CATEGORY(HttpStatus.BAD_REQUEST, "알 수 없는 알림 카테고리입니다.", "JOB-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
