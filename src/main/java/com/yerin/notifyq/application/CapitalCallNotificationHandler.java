package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.*;

import java.time.Duration;
import java.util.*;

import static com.yerin.notifyq.domain.CapitalCallItemStatus.*;

public class CapitalCallNotificationHandler extends StateGuardedHandler {

    // defaulted 항목은 past_due_7 을 받지 않는다
    private static final Set<CapitalCallItemStatus> OPEN_STATES = EnumSet.of(PENDING, PARTIAL, PAST_DUE);

    private static final Set<JobCategory> CATEGORIES = EnumSet.of(
            JobCategory.CAPITAL_CALL_REMINDER_7D,
            JobCategory.CAPITAL_CALL_REMINDER_3D,
            JobCategory.CAPITAL_CALL_REMINDER_1D,
            JobCategory.CAPITAL_CALL_PAST_DUE,
            JobCategory.CAPITAL_CALL_PAST_DUE_7
    );

    public CapitalCallNotificationHandler(EntityStateLookup lookup, NotificationSender sender, String portalBaseUrl) {
        super(lookup, sender, portalBaseUrl);
    }

    @Override
    public Set<JobCategory> categories() {
        return CATEGORIES;
    }

    @Override
    protected Set<? extends LifecycleState> expectedStates(JobCategory category) {
        return OPEN_STATES;
    }

    @Override
    protected Map<String, String> templateParams(JobCategory category, ScheduledJob job, TrackedEntity entity) {
        Map<String, String> params = new HashMap<>();
        putIfPresent(params, "recipientName", entity.attribute("recipientName"));
        putIfPresent(params, "fundName", entity.attribute("fundName"));
        putIfPresent(params, "amountDue", entity.attribute("amountDue"));
        putIfPresent(params, "deadline", entity.attribute("deadline"));

        JobPayload payload = job.getPayload();
        if (payload.anchorAt() != null && payload.scheduledAt() != null) {
            long days = Math.abs(Duration.between(payload.scheduledAt(), payload.anchorAt()).toDays());
            params.put(isPastDue(category) ? "daysPastDue" : "daysUntilDue", String.valueOf(days));
        }
        String callId = entity.attribute("capitalCallId");
        params.put("paymentLink", link(callId == null ? "/capital-calls" : "/capital-calls/" + callId));
        return params;
    }

    private static boolean isPastDue(JobCategory category) {
        return category == JobCategory.CAPITAL_CALL_PAST_DUE || category == JobCategory.CAPITAL_CALL_PAST_DUE_7;
    }
}
