package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.*;

import java.util.*;

public class TeamInviteNotificationHandler extends StateGuardedHandler {

    private static final Set<JobCategory> CATEGORIES =
            EnumSet.of(JobCategory.TEAM_INVITE_REMINDER_3D, JobCategory.TEAM_INVITE_REMINDER_5D);

    public TeamInviteNotificationHandler(EntityStateLookup lookup, NotificationSender sender, String portalBaseUrl) {
        super(lookup, sender, portalBaseUrl);
    }

    @Override
    public Set<JobCategory> categories() {
        return CATEGORIES;
    }

    @Override
    protected Set<? extends LifecycleState> expectedStates(JobCategory category) {
        return EnumSet.of(TeamInviteStatus.PENDING);
    }

    @Override
    protected Map<String, String> templateParams(JobCategory category, ScheduledJob job, TrackedEntity entity) {
        Map<String, String> params = new HashMap<>();
        putIfPresent(params, "fundName", entity.attribute("fundName"));
        putIfPresent(params, "role", entity.attribute("role"));
        String token = entity.attribute("token");
        if (token != null) params.put("acceptLink", link("/invite/" + token));
        return params;
    }
}
