package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.*;

import java.util.*;

import static com.yerin.notifyq.domain.JobCategory.*;

public class InvestorNotificationHandler extends StateGuardedHandler {

    private static final Set<InvestorStatus> ONBOARDING_STATES =
            EnumSet.of(InvestorStatus.ACCOUNT_CREATED, InvestorStatus.ONBOARDING);
    private static final Set<InvestorStatus> SIGNATURE_STATES =
            EnumSet.of(InvestorStatus.DOCUMENTS_SENT, InvestorStatus.AWAITING_SIGNATURE);

    private static final Map<JobCategory, Integer> REMINDER_NUMBER = Map.of(
            ONBOARDING_REMINDER_1, 1,
            ONBOARDING_REMINDER_2, 2,
            ONBOARDING_REMINDER_3, 3,
            SIGNATURE_REMINDER_1, 1,
            SIGNATURE_REMINDER_2, 2
    );

    public InvestorNotificationHandler(EntityStateLookup lookup, NotificationSender sender, String portalBaseUrl) {
        super(lookup, sender, portalBaseUrl);
    }

    @Override
    public Set<JobCategory> categories() {
        return REMINDER_NUMBER.keySet();
    }

    @Override
    protected Set<? extends LifecycleState> expectedStates(JobCategory category) {
        return isSignatureReminder(category) ? SIGNATURE_STATES : ONBOARDING_STATES;
    }

    @Override
    protected Map<String, String> templateParams(JobCategory category, ScheduledJob job, TrackedEntity entity) {
        Map<String, String> params = new HashMap<>();
        putIfPresent(params, "recipientName", entity.attribute("recipientName"));
        putIfPresent(params, "fundName", entity.attribute("fundName"));
        params.put("reminderNumber", String.valueOf(REMINDER_NUMBER.get(category)));
        if (isSignatureReminder(category)) {
            params.put("signatureLink", link("/documents"));
        } else {
            params.put("onboardingLink", link("/onboarding"));
        }
        return params;
    }

    private static boolean isSignatureReminder(JobCategory category) {
        return category == SIGNATURE_REMINDER_1 || category == SIGNATURE_REMINDER_2;
    }
}
