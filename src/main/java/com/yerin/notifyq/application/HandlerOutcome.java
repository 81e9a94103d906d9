package com.yerin.notifyq.application;

public record HandlerOutcome(boolean sent, String messageId, String skipReason) {

    public static final String UNKNOWN_CATEGORY = "unknown category";
    public static final String ENTITY_NOT_FOUND = "entity not found";
    public static final String STALE_STATE = "stale state";
    public static final String NO_RECIPIENT = "no recipient";

    public static HandlerOutcome sent(String messageId) {
        return new HandlerOutcome(true, messageId, null);
    }

    public static HandlerOutcome skipped(String reason) {
        return new HandlerOutcome(false, null, reason);
    }
}
