package com.yerin.notifyq.domain;

import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public enum ProspectStatus implements LifecycleState {
    DRAFT("draft"),
    KYC_SENT("kyc_sent"),
    SUBMITTED("submitted"),
    KYC_SUBMITTED("kyc_submitted"),
    PRE_QUALIFIED("pre_qualified"),
    NOT_ELIGIBLE("not_eligible"),
    MEETING_SCHEDULED("meeting_scheduled"),
    MEETING_COMPLETE("meeting_complete"),
    CONSIDERING("considering"),
    NOT_A_FIT("not_a_fit"),
    ACCOUNT_INVITE_SENT("account_invite_sent"),
    ACCOUNT_CREATED("account_created"),
    ONBOARDING_SUBMITTED("onboarding_submitted"),
    DOCUMENTS_PENDING("documents_pending"),
    DOCUMENTS_APPROVED("documents_approved"),
    DOCUMENTS_REJECTED("documents_rejected"),
    DOCUSIGN_SENT("docusign_sent"),
    DOCUSIGN_SIGNED("docusign_signed"),
    CONVERTED("converted");

    private final String value;

    @Override
    public String value() { return value; }

    @Override
    public EntityFamily family() { return EntityFamily.PROSPECT; }

    public static Optional<ProspectStatus> from(String value) {
        if (value == null) return Optional.empty();
        for (ProspectStatus s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
