package com.yerin.notifyq.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
public enum JobCategory {
    // prospect
    KYC_REMINDER_1("kyc_reminder_1", EntityFamily.PROSPECT),
    KYC_REMINDER_2("kyc_reminder_2", EntityFamily.PROSPECT),
    KYC_REMINDER_3("kyc_reminder_3", EntityFamily.PROSPECT),
    KYC_NOT_ELIGIBLE("kyc_not_eligible", EntityFamily.PROSPECT),
    MEETING_REMINDER_24HR("meeting_reminder_24hr", EntityFamily.PROSPECT),
    MEETING_REMINDER_15MIN("meeting_reminder_15min", EntityFamily.PROSPECT),
    MEETING_NOSHOW("meeting_noshow", EntityFamily.PROSPECT),
    POST_MEETING_PROCEED("post_meeting_proceed", EntityFamily.PROSPECT),
    POST_MEETING_CONSIDERING("post_meeting_considering", EntityFamily.PROSPECT),
    POST_MEETING_NOT_FIT("post_meeting_not_fit", EntityFamily.PROSPECT),
    NURTURE_DAY15("nurture_day15", EntityFamily.PROSPECT),
    NURTURE_DAY23("nurture_day23", EntityFamily.PROSPECT),
    NURTURE_DAY30("nurture_day30", EntityFamily.PROSPECT),
    DORMANT_CLOSEOUT("dormant_closeout", EntityFamily.PROSPECT),

    // investor
    ONBOARDING_REMINDER_1("onboarding_reminder_1", EntityFamily.INVESTOR),
    ONBOARDING_REMINDER_2("onboarding_reminder_2", EntityFamily.INVESTOR),
    ONBOARDING_REMINDER_3("onboarding_reminder_3", EntityFamily.INVESTOR),
    SIGNATURE_REMINDER_1("signature_reminder_1", EntityFamily.INVESTOR),
    SIGNATURE_REMINDER_2("signature_reminder_2", EntityFamily.INVESTOR),

    // capital call line item
    CAPITAL_CALL_REMINDER_7D("capital_call_reminder_7d", EntityFamily.CAPITAL_CALL),
    CAPITAL_CALL_REMINDER_3D("capital_call_reminder_3d", EntityFamily.CAPITAL_CALL),
    CAPITAL_CALL_REMINDER_1D("capital_call_reminder_1d", EntityFamily.CAPITAL_CALL),
    CAPITAL_CALL_PAST_DUE("capital_call_past_due", EntityFamily.CAPITAL_CALL),
    CAPITAL_CALL_PAST_DUE_7("capital_call_past_due_7", EntityFamily.CAPITAL_CALL),

    // team invite
    TEAM_INVITE_REMINDER_3D("team_invite_reminder_3d", EntityFamily.TEAM_INVITE),
    TEAM_INVITE_REMINDER_5D("team_invite_reminder_5d", EntityFamily.TEAM_INVITE);

    private static final Map<String, JobCategory> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(JobCategory::getWireName, Function.identity()));

    private final String wireName;
    private final EntityFamily family;

    public static Optional<JobCategory> fromWireName(String wireName) {
        if (wireName == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
