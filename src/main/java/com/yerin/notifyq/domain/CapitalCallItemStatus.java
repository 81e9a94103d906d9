package com.yerin.notifyq.domain;

import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public enum CapitalCallItemStatus implements LifecycleState {
    PENDING("pending"),
    PARTIAL("partial"),
    PAST_DUE("past_due"),
    PAID("paid"),
    DEFAULTED("defaulted"),
    CANCELLED("cancelled");

    private final String value;

    @Override
    public String value() { return value; }

    @Override
    public EntityFamily family() { return EntityFamily.CAPITAL_CALL; }

    public static Optional<CapitalCallItemStatus> from(String value) {
        if (value == null) return Optional.empty();
        for (CapitalCallItemStatus s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
