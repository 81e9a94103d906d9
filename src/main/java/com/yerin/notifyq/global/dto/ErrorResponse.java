package com.yerin.notifyq.global.dto;

import com.yerin.notifyq.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;

public record ErrorResponse(
        String code,
        String message,
        String method,
        String path,
        Instant timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, HttpServletRequest request) {
        return new ErrorResponse(
                errorCode.getCode(),
                errorCode.getMessage(),
                request.getMethod(),
                request.getRequestURI(),
                Instant.now()
        );
    }
}
