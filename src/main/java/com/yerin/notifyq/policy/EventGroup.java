package com.yerin.notifyq.policy;

import com.yerin.notifyq.domain.EntityFamily;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 이벤트 하나가 만들어내는 알림 묶음. anchor 는 오프셋 계산의 기준 시각이다.
 */
@Getter
@RequiredArgsConstructor
public enum EventGroup {
    KYC_REMINDERS(EntityFamily.PROSPECT, "kyc sent at"),
    MEETING_REMINDERS(EntityFamily.PROSPECT, "meeting time"),
    NURTURE_SEQUENCE(EntityFamily.PROSPECT, "marked considering at"),
    INVESTOR_ONBOARDING_REMINDERS(EntityFamily.INVESTOR, "account created at"),
    INVESTOR_SIGNATURE_REMINDERS(EntityFamily.INVESTOR, "documents sent at"),
    CAPITAL_CALL_REMINDERS(EntityFamily.CAPITAL_CALL, "payment deadline"),
    CAPITAL_CALL_PAST_DUE(EntityFamily.CAPITAL_CALL, "payment deadline"),
    TEAM_INVITE_REMINDERS(EntityFamily.TEAM_INVITE, "invite sent at");

    private final EntityFamily family;
    private final String anchorDescription;

    public static EventGroup from(String value) {
        for (EventGroup g : values()) {
            if (g.name().equalsIgnoreCase(value) || g.name().replace('_', '-').equalsIgnoreCase(value)) return g;
        }
        throw new IllegalArgumentException("unknown event group: " + value);
    }
}
