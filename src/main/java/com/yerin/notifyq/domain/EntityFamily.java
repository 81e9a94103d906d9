package com.yerin.notifyq.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * 알림 대상 엔티티 계열. namespace 가 없으면 {@code category:entityId} 키를 쓰고,
 * 있으면 {@code category:namespace:entityId} 키를 쓴다.
 */
@Getter
@RequiredArgsConstructor
public enum EntityFamily {
    PROSPECT("prospect", null),
    INVESTOR("investor", "investor"),
    CAPITAL_CALL("capital_call", "capital_call"),
    TEAM_INVITE("team_invite", "team_invite");

    private final String value;
    private final String namespace;

    public boolean isNamespaced() {
        return namespace != null;
    }

    /** 알 수 없는 값이면 empty. 예외를 던지지 않는다. */
    public Optional<? extends LifecycleState> parseState(String state) {
        switch (this) {
            case PROSPECT: return ProspectStatus.from(state);
            case INVESTOR: return InvestorStatus.from(state);
            case CAPITAL_CALL: return CapitalCallItemStatus.from(state);
            case TEAM_INVITE: return TeamInviteStatus.from(state);
            default: return Optional.empty();
        }
    }

    public static EntityFamily from(String value) {
        for (EntityFamily f : values()) {
            if (f.value.equalsIgnoreCase(value) || f.name().equalsIgnoreCase(value)) return f;
        }
        throw new IllegalArgumentException("unknown entity family: " + value);
    }
}
