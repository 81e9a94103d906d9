package com.yerin.notifyq.domain;

import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public enum InvestorStatus implements LifecycleState {
    PROSPECT("prospect"),
    KYC_SUBMITTED("kyc_submitted"),
    ACCOUNT_CREATED("account_created"),
    ONBOARDING("onboarding"),
    PENDING_VALIDATION("pending_validation"),
    DOCUMENTS_PENDING("documents_pending"),
    DOCUMENTS_SENT("documents_sent"),
    AWAITING_SIGNATURE("awaiting_signature"),
    DOCUMENTS_SIGNED("documents_signed"),
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    @Override
    public String value() { return value; }

    @Override
    public EntityFamily family() { return EntityFamily.INVESTOR; }

    public static Optional<InvestorStatus> from(String value) {
        if (value == null) return Optional.empty();
        for (InvestorStatus s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
