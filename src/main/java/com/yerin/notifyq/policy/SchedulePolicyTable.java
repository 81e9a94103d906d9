package com.yerin.notifyq.policy;

import com.yerin.notifyq.domain.JobCategory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.yerin.notifyq.policy.EventGroup.*;
import static com.yerin.notifyq.policy.SchedulePolicyEntry.after;
import static com.yerin.notifyq.policy.SchedulePolicyEntry.before;

/**
 * 이벤트 묶음별 (카테고리, 오프셋) 목록. 프로세스 시작 시 고정되고 런타임에 바뀌지 않는다.
 */
public final class SchedulePolicyTable {

    public static final Duration TEAM_INVITE_EXPIRY = Duration.ofDays(7);

    static final String DAYS_REMAINING = "daysRemaining";

    private static final Map<EventGroup, List<SchedulePolicyEntry>> TABLE = build();

    private SchedulePolicyTable() {}

    public static List<SchedulePolicyEntry> entries(EventGroup group) {
        return TABLE.getOrDefault(group, List.of());
    }

    public static List<JobCategory> categories(EventGroup group) {
        return entries(group).stream().map(SchedulePolicyEntry::category).toList();
    }

    private static Map<EventGroup, List<SchedulePolicyEntry>> build() {
        Map<EventGroup, List<SchedulePolicyEntry>> t = new EnumMap<>(EventGroup.class);

        t.put(KYC_REMINDERS, List.of(
                after(KYC_REMINDERS, JobCategory.KYC_REMINDER_1, Duration.ofHours(48)),
                after(KYC_REMINDERS, JobCategory.KYC_REMINDER_2, Duration.ofDays(5)),
                after(KYC_REMINDERS, JobCategory.KYC_REMINDER_3, Duration.ofDays(10))
        ));

        t.put(MEETING_REMINDERS, List.of(
                before(MEETING_REMINDERS, JobCategory.MEETING_REMINDER_24HR, Duration.ofHours(24)),
                before(MEETING_REMINDERS, JobCategory.MEETING_REMINDER_15MIN, Duration.ofMinutes(15)),
                // 미팅 이후 노쇼 확인, 미팅이 끝나면 suppression 으로 취소된다
                after(MEETING_REMINDERS, JobCategory.MEETING_NOSHOW, Duration.ofMinutes(30))
        ));

        t.put(NURTURE_SEQUENCE, List.of(
                after(NURTURE_SEQUENCE, JobCategory.NURTURE_DAY15, Duration.ofDays(15)),
                after(NURTURE_SEQUENCE, JobCategory.NURTURE_DAY23, Duration.ofDays(23)),
                after(NURTURE_SEQUENCE, JobCategory.NURTURE_DAY30, Duration.ofDays(30)),
                after(NURTURE_SEQUENCE, JobCategory.DORMANT_CLOSEOUT, Duration.ofDays(31))
        ));

        t.put(INVESTOR_ONBOARDING_REMINDERS, List.of(
                after(INVESTOR_ONBOARDING_REMINDERS, JobCategory.ONBOARDING_REMINDER_1, Duration.ofHours(48)),
                after(INVESTOR_ONBOARDING_REMINDERS, JobCategory.ONBOARDING_REMINDER_2, Duration.ofHours(96)),
                after(INVESTOR_ONBOARDING_REMINDERS, JobCategory.ONBOARDING_REMINDER_3, Duration.ofHours(144))
        ));

        t.put(INVESTOR_SIGNATURE_REMINDERS, List.of(
                after(INVESTOR_SIGNATURE_REMINDERS, JobCategory.SIGNATURE_REMINDER_1, Duration.ofHours(48)),
                after(INVESTOR_SIGNATURE_REMINDERS, JobCategory.SIGNATURE_REMINDER_2, Duration.ofHours(96))
        ));

        t.put(CAPITAL_CALL_REMINDERS, List.of(
                before(CAPITAL_CALL_REMINDERS, JobCategory.CAPITAL_CALL_REMINDER_7D, Duration.ofDays(7)),
                before(CAPITAL_CALL_REMINDERS, JobCategory.CAPITAL_CALL_REMINDER_3D, Duration.ofDays(3)),
                before(CAPITAL_CALL_REMINDERS, JobCategory.CAPITAL_CALL_REMINDER_1D, Duration.ofDays(1))
        ));

        t.put(CAPITAL_CALL_PAST_DUE, List.of(
                after(CAPITAL_CALL_PAST_DUE, JobCategory.CAPITAL_CALL_PAST_DUE, Duration.ZERO),
                after(CAPITAL_CALL_PAST_DUE, JobCategory.CAPITAL_CALL_PAST_DUE_7, Duration.ofDays(7))
        ));

        t.put(TEAM_INVITE_REMINDERS, List.of(
                inviteReminder(JobCategory.TEAM_INVITE_REMINDER_3D, Duration.ofDays(3)),
                inviteReminder(JobCategory.TEAM_INVITE_REMINDER_5D, Duration.ofDays(5))
        ));

        for (EventGroup g : EventGroup.values()) {
            if (!t.containsKey(g)) throw new IllegalStateException("no schedule policy for " + g);
        }
        return Map.copyOf(t);
    }

    private static SchedulePolicyEntry inviteReminder(JobCategory category, Duration offset) {
        long daysRemaining = TEAM_INVITE_EXPIRY.minus(offset).toDays();
        return after(TEAM_INVITE_REMINDERS, category, offset)
                .withMetadata(DAYS_REMAINING, Long.toString(daysRemaining));
    }
}
