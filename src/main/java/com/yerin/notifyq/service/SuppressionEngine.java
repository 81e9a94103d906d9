package com.yerin.notifyq.service;

import com.yerin.notifyq.domain.EntityFamily;
import com.yerin.notifyq.domain.JobCategory;
import com.yerin.notifyq.domain.LifecycleState;
import com.yerin.notifyq.policy.SuppressionRule;
import com.yerin.notifyq.policy.SuppressionRuleTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 상태 전이를 받아 더 이상 의미가 없는 pending 알림을 취소한다. 최선 노력이며 예외를 던지지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuppressionEngine {

    private final NotificationScheduler scheduler;

    /**
     * @param previousState 모르면 null
     * @return 실제로 취소된 작업 수
     */
    public int onTransition(EntityFamily family, String entityId, String newState, String previousState) {
        List<SuppressionRule> matched = SuppressionRuleTable.match(family, newState, previousState);
        if (matched.isEmpty()) {
            log.debug("[Suppression] no rule family={}, entityId={}, {} -> {}", family, entityId, previousState, newState);
            return 0;
        }

        Set<JobCategory> categories = EnumSet.noneOf(JobCategory.class);
        for (SuppressionRule r : matched) categories.addAll(r.cancels());

        int cancelled = scheduler.cancelAll(categories, entityId);
        log.info("[Suppression] family={}, entityId={}, {} -> {}, rules={}, cancelled={}/{}",
                family.getValue(), entityId, previousState, newState,
                matched.stream().map(SuppressionRule::name).toList(), cancelled, categories.size());
        return cancelled;
    }

    public int onTransition(String entityId, LifecycleState newState, LifecycleState previousState) {
        return onTransition(newState.family(), entityId, newState.value(),
                previousState == null ? null : previousState.value());
    }
}
