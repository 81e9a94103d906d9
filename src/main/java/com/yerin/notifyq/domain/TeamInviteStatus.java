package com.yerin.notifyq.domain;

import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public enum TeamInviteStatus implements LifecycleState {
    PENDING("pending"),
    ACCEPTED("accepted"),
    EXPIRED("expired"),
    CANCELLED("cancelled");

    private final String value;

    @Override
    public String value() { return value; }

    @Override
    public EntityFamily family() { return EntityFamily.TEAM_INVITE; }

    public static Optional<TeamInviteStatus> from(String value) {
        if (value == null) return Optional.empty();
        for (TeamInviteStatus s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
