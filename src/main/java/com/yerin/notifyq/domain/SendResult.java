package com.yerin.notifyq.domain;

public record SendResult(boolean success, String messageId, String error) {
    public static SendResult ok(String messageId) {
        return new SendResult(true, messageId, null);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, null, error);
    }
}
