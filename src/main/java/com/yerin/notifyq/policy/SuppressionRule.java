package com.yerin.notifyq.policy;

import com.yerin.notifyq.domain.EntityFamily;
import com.yerin.notifyq.domain.JobCategory;

import java.util.Set;

public record SuppressionRule(
        String name,
        EntityFamily family,
        StatePattern previousState,
        StatePattern newState,
        Set<JobCategory> cancels
) {
    public SuppressionRule {
        cancels = Set.copyOf(cancels);
        for (JobCategory c : cancels) {
            if (c.getFamily() != family) {
                throw new IllegalArgumentException(name + ": " + c + " does not belong to " + family);
            }
        }
    }

    public boolean matches(EntityFamily family, String newState, String previousState) {
        return this.family == family
                && this.newState.matches(newState)
                && this.previousState.matches(previousState);
    }
}
