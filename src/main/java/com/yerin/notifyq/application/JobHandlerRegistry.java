package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.JobCategory;

import java.util.*;

/**
 * category -> handler 디스패치 테이블. 생성 시 한 번 만들어지고 이후 바뀌지 않는다.
 */
public class JobHandlerRegistry {
    private final Map<JobCategory, JobHandler> map;

    public JobHandlerRegistry(List<? extends JobHandler> handlers) {
        Map<JobCategory, JobHandler> m = new EnumMap<>(JobCategory.class);
        for (JobHandler h : handlers) {
            for (JobCategory c : h.categories()) {
                JobHandler prev = m.put(c, h);
                if (prev != null) {
                    throw new IllegalStateException("duplicate handler for category=" + c
                            + ": " + prev.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
                }
            }
        }
        this.map = Collections.unmodifiableMap(m);
    }

    public Optional<JobHandler> find(String category) {
        return JobCategory.fromWireName(category).map(map::get);
    }

    public Set<JobCategory> categories() {
        return map.keySet();
    }
}
