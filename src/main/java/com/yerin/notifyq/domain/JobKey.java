package com.yerin.notifyq.domain;

/**
 * 큐 중복 제거와 취소에 쓰는 결정적 키. 시계나 난수에 의존하지 않는다.
 */
public final class JobKey {
    private static final String SEPARATOR = ":";

    private JobKey() {}

    public static String of(JobCategory category, String entityId) {
        if (category == null) throw new IllegalArgumentException("category is required");
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId is required for " + category.getWireName());
        }
        EntityFamily family = category.getFamily();
        if (!family.isNamespaced()) {
            return category.getWireName() + SEPARATOR + entityId;
        }
        return category.getWireName() + SEPARATOR + family.getNamespace() + SEPARATOR + entityId;
    }
}
