package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 발송 직전에 엔티티를 다시 읽어 카테고리가 기대하는 상태인지 확인한다.
 * 취소와 실행이 경합해도 이 검사가 최종 방어선이다.
 */
@Slf4j
public abstract class StateGuardedHandler implements JobHandler {

    protected final EntityStateLookup lookup;
    protected final NotificationSender sender;
    protected final String portalBaseUrl;

    protected StateGuardedHandler(EntityStateLookup lookup, NotificationSender sender, String portalBaseUrl) {
        this.lookup = lookup;
        this.sender = sender;
        this.portalBaseUrl = portalBaseUrl;
    }

    protected abstract Set<? extends LifecycleState> expectedStates(JobCategory category);

    protected abstract Map<String, String> templateParams(JobCategory category, ScheduledJob job, TrackedEntity entity);

    @Override
    public HandlerOutcome handle(ScheduledJob job) {
        JobCategory category = job.getPayload().resolveCategory()
                .orElseThrow(() -> new IllegalArgumentException("unknown category: " + job.category()));

        var found = lookup.find(job.entityId());
        if (found.isEmpty()) return HandlerOutcome.skipped(HandlerOutcome.ENTITY_NOT_FOUND);

        TrackedEntity entity = found.get();
        if (!entity.isIn(expectedStates(category))) {
            log.debug("[Handler.{}] stale key={}, state={}", lookup.family().getValue(), job.getKey(),
                    entity.state() == null ? "unknown" : entity.state().value());
            return HandlerOutcome.skipped(HandlerOutcome.STALE_STATE);
        }
        if (entity.recipient() == null || entity.recipient().isBlank()) {
            return HandlerOutcome.skipped(HandlerOutcome.NO_RECIPIENT);
        }

        Map<String, String> params = new HashMap<>(job.getPayload().metadata());
        params.putAll(templateParams(category, job, entity));
        params.put("template", category.getWireName());

        SendResult result = sender.send(entity.recipient(), params);
        if (!result.success()) {
            throw new NotificationSendException(category, job.getKey(), result.error());
        }
        log.info("[Handler.{}] sent key={}, messageId={}", lookup.family().getValue(), job.getKey(), result.messageId());
        return HandlerOutcome.sent(result.messageId());
    }

    protected String link(String path) {
        return portalBaseUrl + path;
    }

    protected static void putIfPresent(Map<String, String> params, String name, String value) {
        if (value != null) params.put(name, value);
    }
}
