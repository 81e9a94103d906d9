package com.yerin.notifyq.domain;

import java.util.Optional;

public interface EntityStateLookup {
    EntityFamily family();

    Optional<TrackedEntity> find(String entityId);
}
