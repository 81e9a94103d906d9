package com.yerin.notifyq.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 네 엔티티 계열이 하나의 큐를 공유하므로 category 를 태그로 쓰는 페이로드.
 * category 는 wire 이름 그대로 저장해서 모르는 값도 역직렬화는 된다.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record JobPayload(
        String category,
        String entityId,
        String fundId,
        Instant anchorAt,
        Instant scheduledAt,
        Map<String, String> metadata
) {
    public JobPayload {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static JobPayload of(JobCategory category, String entityId, String fundId,
                                Instant anchorAt, Instant scheduledAt, Map<String, String> metadata) {
        return new JobPayload(category.getWireName(), entityId, fundId, anchorAt, scheduledAt, metadata);
    }

    @JsonIgnore
    public Optional<JobCategory> resolveCategory() {
        return JobCategory.fromWireName(category);
    }

    public String metadata(String name) {
        return metadata.get(name);
    }
}
