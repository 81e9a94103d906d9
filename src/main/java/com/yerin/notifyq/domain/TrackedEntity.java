package com.yerin.notifyq.domain;

import java.util.Map;
import java.util.Set;

/**
 * 외부 엔티티 저장소에서 읽어온 읽기 전용 스냅샷.
 * state 는 저장소 값이 알 수 없는 상태이면 null 이다.
 */
public record TrackedEntity(
        EntityFamily family,
        String id,
        String fundId,
        LifecycleState state,
        String recipient,
        Map<String, String> attributes
) {
    public TrackedEntity {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public boolean isIn(Set<? extends LifecycleState> states) {
        return state != null && states.contains(state);
    }
}
