package com.yerin.notifyq.policy;

import com.yerin.notifyq.domain.JobCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record SchedulePolicyEntry(
        EventGroup group,
        JobCategory category,
        Duration offset,
        OffsetDirection direction,
        Map<String, String> metadata
) {
    public SchedulePolicyEntry {
        if (offset.isNegative()) throw new IllegalArgumentException("offset must be non-negative, use direction");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    static SchedulePolicyEntry after(EventGroup group, JobCategory category, Duration offset) {
        return new SchedulePolicyEntry(group, category, offset, OffsetDirection.AFTER_ANCHOR, Map.of());
    }

    static SchedulePolicyEntry before(EventGroup group, JobCategory category, Duration offset) {
        return new SchedulePolicyEntry(group, category, offset, OffsetDirection.BEFORE_ANCHOR, Map.of());
    }

    SchedulePolicyEntry withMetadata(String name, String value) {
        return new SchedulePolicyEntry(group, category, offset, direction, Map.of(name, value));
    }

    public Instant fireAt(Instant anchor) {
        return direction == OffsetDirection.BEFORE_ANCHOR ? anchor.minus(offset) : anchor.plus(offset);
    }
}
