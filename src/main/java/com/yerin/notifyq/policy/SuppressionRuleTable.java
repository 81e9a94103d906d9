package com.yerin.notifyq.policy;

import com.yerin.notifyq.domain.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.yerin.notifyq.policy.StatePattern.*;

/**
 * 상태 전이 → 취소할 카테고리 집합. 선언적으로 전부 나열하고 런타임에 바뀌지 않는다.
 */
public final class SuppressionRuleTable {

    public static final Set<JobCategory> KYC_REMINDERS = Set.copyOf(SchedulePolicyTable.categories(EventGroup.KYC_REMINDERS));
    public static final Set<JobCategory> MEETING_REMINDERS = Set.copyOf(SchedulePolicyTable.categories(EventGroup.MEETING_REMINDERS));
    public static final Set<JobCategory> NURTURE_SEQUENCE = Set.copyOf(SchedulePolicyTable.categories(EventGroup.NURTURE_SEQUENCE));
    public static final Set<JobCategory> ALL_PROSPECT_SEQUENCES = union(KYC_REMINDERS, MEETING_REMINDERS, NURTURE_SEQUENCE);

    public static final Set<JobCategory> ONBOARDING_REMINDERS = Set.copyOf(SchedulePolicyTable.categories(EventGroup.INVESTOR_ONBOARDING_REMINDERS));
    public static final Set<JobCategory> SIGNATURE_REMINDERS = Set.copyOf(SchedulePolicyTable.categories(EventGroup.INVESTOR_SIGNATURE_REMINDERS));
    public static final Set<JobCategory> ALL_INVESTOR_SEQUENCES = union(ONBOARDING_REMINDERS, SIGNATURE_REMINDERS);

    public static final Set<JobCategory> CAPITAL_CALL_REMINDERS = Set.copyOf(SchedulePolicyTable.categories(EventGroup.CAPITAL_CALL_REMINDERS));
    public static final Set<JobCategory> CAPITAL_CALL_PAST_DUE = Set.copyOf(SchedulePolicyTable.categories(EventGroup.CAPITAL_CALL_PAST_DUE));
    public static final Set<JobCategory> ALL_CAPITAL_CALL_SEQUENCES = union(CAPITAL_CALL_REMINDERS, CAPITAL_CALL_PAST_DUE);

    public static final Set<JobCategory> TEAM_INVITE_REMINDERS = Set.copyOf(SchedulePolicyTable.categories(EventGroup.TEAM_INVITE_REMINDERS));

    private static final List<SuppressionRule> RULES = List.of(
            // prospect
            new SuppressionRule("kyc-completed", EntityFamily.PROSPECT,
                    oneOf(ProspectStatus.KYC_SENT),
                    oneOf(ProspectStatus.KYC_SUBMITTED, ProspectStatus.PRE_QUALIFIED, ProspectStatus.NOT_ELIGIBLE),
                    KYC_REMINDERS),
            new SuppressionRule("meeting-completed", EntityFamily.PROSPECT,
                    oneOf(ProspectStatus.MEETING_SCHEDULED),
                    oneOf(ProspectStatus.MEETING_COMPLETE),
                    MEETING_REMINDERS),
            new SuppressionRule("ready-to-invest", EntityFamily.PROSPECT,
                    oneOf(ProspectStatus.CONSIDERING),
                    oneOf(ProspectStatus.ACCOUNT_INVITE_SENT),
                    NURTURE_SEQUENCE),
            new SuppressionRule("prospect-closed-out", EntityFamily.PROSPECT,
                    any(),
                    oneOf(ProspectStatus.NOT_A_FIT),
                    ALL_PROSPECT_SEQUENCES),

            // investor
            new SuppressionRule("profile-completed", EntityFamily.INVESTOR,
                    oneOf(InvestorStatus.ACCOUNT_CREATED),
                    oneOf(InvestorStatus.DOCUMENTS_PENDING),
                    ONBOARDING_REMINDERS),
            new SuppressionRule("documents-signed", EntityFamily.INVESTOR,
                    oneOf(InvestorStatus.DOCUMENTS_SENT),
                    oneOf(InvestorStatus.DOCUMENTS_SIGNED),
                    SIGNATURE_REMINDERS),
            new SuppressionRule("investor-activated-or-deactivated", EntityFamily.INVESTOR,
                    any(),
                    oneOf(InvestorStatus.ACTIVE, InvestorStatus.INACTIVE),
                    ALL_INVESTOR_SEQUENCES),

            // capital call line item
            new SuppressionRule("wire-received", EntityFamily.CAPITAL_CALL,
                    noneOf(CapitalCallItemStatus.PAID),
                    oneOf(CapitalCallItemStatus.PAID),
                    ALL_CAPITAL_CALL_SEQUENCES),
            new SuppressionRule("capital-call-cancelled", EntityFamily.CAPITAL_CALL,
                    any(),
                    oneOf(CapitalCallItemStatus.CANCELLED),
                    ALL_CAPITAL_CALL_SEQUENCES),
            // default notice 가 past-due 안내를 대체한다
            new SuppressionRule("default-initiated", EntityFamily.CAPITAL_CALL,
                    any(),
                    oneOf(CapitalCallItemStatus.DEFAULTED),
                    CAPITAL_CALL_PAST_DUE),

            // team invite
            new SuppressionRule("invite-closed", EntityFamily.TEAM_INVITE,
                    oneOf(TeamInviteStatus.PENDING),
                    oneOf(TeamInviteStatus.ACCEPTED, TeamInviteStatus.CANCELLED, TeamInviteStatus.EXPIRED),
                    TEAM_INVITE_REMINDERS)
    );

    private SuppressionRuleTable() {}

    public static List<SuppressionRule> rules() {
        return RULES;
    }

    public static List<SuppressionRule> match(EntityFamily family, String newState, String previousState) {
        return RULES.stream()
                .filter(r -> r.matches(family, newState, previousState))
                .toList();
    }

    @SafeVarargs
    private static Set<JobCategory> union(Set<JobCategory>... sets) {
        Set<JobCategory> out = EnumSet.noneOf(JobCategory.class);
        for (Set<JobCategory> s : sets) out.addAll(s);
        return Set.copyOf(out);
    }
}
