package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.*;

import java.util.*;

import static com.yerin.notifyq.domain.JobCategory.*;
import static com.yerin.notifyq.domain.ProspectStatus.*;

public class ProspectNotificationHandler extends StateGuardedHandler {

    private static final Map<JobCategory, Set<ProspectStatus>> EXPECTED = new EnumMap<>(JobCategory.class);

    static {
        for (JobCategory c : List.of(KYC_REMINDER_1, KYC_REMINDER_2, KYC_REMINDER_3)) {
            EXPECTED.put(c, EnumSet.of(KYC_SENT));
        }
        for (JobCategory c : List.of(MEETING_REMINDER_24HR, MEETING_REMINDER_15MIN, MEETING_NOSHOW)) {
            EXPECTED.put(c, EnumSet.of(MEETING_SCHEDULED));
        }
        for (JobCategory c : List.of(NURTURE_DAY15, NURTURE_DAY23, NURTURE_DAY30, DORMANT_CLOSEOUT)) {
            EXPECTED.put(c, EnumSet.of(CONSIDERING));
        }
        EXPECTED.put(KYC_NOT_ELIGIBLE, EnumSet.of(NOT_ELIGIBLE));
        EXPECTED.put(POST_MEETING_PROCEED, EnumSet.of(MEETING_COMPLETE, ACCOUNT_INVITE_SENT));
        EXPECTED.put(POST_MEETING_CONSIDERING, EnumSet.of(CONSIDERING));
        EXPECTED.put(POST_MEETING_NOT_FIT, EnumSet.of(NOT_A_FIT));
    }

    public ProspectNotificationHandler(EntityStateLookup lookup, NotificationSender sender, String portalBaseUrl) {
        super(lookup, sender, portalBaseUrl);
    }

    @Override
    public Set<JobCategory> categories() {
        return EXPECTED.keySet();
    }

    @Override
    protected Set<? extends LifecycleState> expectedStates(JobCategory category) {
        return EXPECTED.getOrDefault(category, Set.of());
    }

    @Override
    protected Map<String, String> templateParams(JobCategory category, ScheduledJob job, TrackedEntity entity) {
        Map<String, String> params = new HashMap<>();
        putIfPresent(params, "recipientName", entity.attribute("recipientName"));
        putIfPresent(params, "fundName", entity.attribute("fundName"));

        switch (category) {
            case KYC_REMINDER_1, KYC_REMINDER_2, KYC_REMINDER_3 -> {
                params.put("reminderNumber", category.getWireName().substring("kyc_reminder_".length()));
                String token = entity.attribute("kycToken");
                if (token != null) params.put("kycLink", link("/kyc/" + token));
            }
            case MEETING_REMINDER_24HR, MEETING_REMINDER_15MIN, MEETING_NOSHOW -> {
                // 미팅 시각은 스케줄 anchor
                if (job.getPayload().anchorAt() != null) {
                    params.put("meetingTime", job.getPayload().anchorAt().toString());
                }
                if (category == MEETING_NOSHOW) params.put("rescheduleLink", link("/schedule"));
            }
            case POST_MEETING_PROCEED -> params.put("accountLink", link("/account/create"));
            default -> { }
        }
        return params;
    }
}
