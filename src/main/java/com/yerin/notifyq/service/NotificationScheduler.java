package com.yerin.notifyq.service;

import com.yerin.notifyq.domain.*;
import com.yerin.notifyq.policy.EventGroup;
import com.yerin.notifyq.policy.SchedulePolicyEntry;
import com.yerin.notifyq.policy.SchedulePolicyTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 비즈니스 이벤트를 정책 테이블에 따라 지연 작업으로 바꾼다.
 * 브로커 오류는 경고 로그와 메트릭으로만 남기고 호출자에게 던지지 않는다.
 */
@Slf4j
@Service
public class NotificationScheduler {

    private final DelayedJobQueue queue;
    private final Executor enqueueExecutor;
    private final Clock clock;
    private final NotifyqMetrics metrics;

    public NotificationScheduler(DelayedJobQueue queue,
                                 @Qualifier("enqueueExecutor") Executor enqueueExecutor,
                                 Clock clock,
                                 NotifyqMetrics metrics) {
        this.queue = queue;
        this.enqueueExecutor = enqueueExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    public ScheduleResult schedule(EventGroup group, String entityId, String fundId, Instant anchor) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(anchor, "anchor");
        requireEntityId(entityId);

        if (!queue.isAvailable()) {
            log.warn("[Scheduler] broker not configured, skipped group={}, entityId={}", group, entityId);
            return ScheduleResult.unavailable(entityId);
        }

        Instant now = clock.instant();
        List<JobCategory> skippedPast = new ArrayList<>();
        List<CompletableFuture<EnqueueOutcome>> pending = new ArrayList<>();

        for (SchedulePolicyEntry entry : SchedulePolicyTable.entries(group)) {
            Instant fireAt = entry.fireAt(anchor);
            long delay = Duration.between(now, fireAt).toMillis();
            if (delay <= 0) {
                skippedPast.add(entry.category());
                metrics.incSkippedPast();
                log.debug("[Scheduler] past offset skipped category={}, entityId={}, fireAt={}", entry.category(), entityId, fireAt);
                continue;
            }
            JobPayload payload = JobPayload.of(entry.category(), entityId, fundId, anchor, fireAt, entry.metadata());
            pending.add(enqueueAsync(entry.category(), payload, delay));
        }

        ScheduleResult result = collect(entityId, skippedPast, pending);
        log.info("[Scheduler] group={}, entityId={}, enqueued={}, skippedPast={}, failed={}",
                group, entityId, result.enqueuedCount(), skippedPast.size(), result.failed().size());
        return result;
    }

    /** 정책 테이블 밖의 단건 지연 발송. dueAt 이 지났으면 건너뛴다. */
    public ScheduleResult scheduleOne(JobCategory category, String entityId, String fundId,
                                      Instant dueAt, Map<String, String> metadata) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(dueAt, "dueAt");
        requireEntityId(entityId);

        if (!queue.isAvailable()) {
            log.warn("[Scheduler] broker not configured, skipped category={}, entityId={}", category, entityId);
            return ScheduleResult.unavailable(entityId);
        }

        long delay = Duration.between(clock.instant(), dueAt).toMillis();
        if (delay <= 0) {
            metrics.incSkippedPast();
            return new ScheduleResult(entityId, true, List.of(), List.of(category), List.of());
        }
        JobPayload payload = JobPayload.of(category, entityId, fundId, dueAt, dueAt, metadata);
        return collect(entityId, List.of(), List.of(enqueueAsync(category, payload, delay)));
    }

    /** 전환 시점에 바로 보내는 단발 알림을 워커에 넘긴다. 상태 검사와 재시도를 그대로 받는다. */
    public ScheduleResult enqueueNow(JobCategory category, String entityId, String fundId, Map<String, String> metadata) {
        Objects.requireNonNull(category, "category");
        requireEntityId(entityId);

        if (!queue.isAvailable()) {
            log.warn("[Scheduler] broker not configured, skipped category={}, entityId={}", category, entityId);
            return ScheduleResult.unavailable(entityId);
        }
        Instant now = clock.instant();
        JobPayload payload = JobPayload.of(category, entityId, fundId, now, now, metadata);
        return collect(entityId, List.of(), List.of(enqueueAsync(category, payload, 0)));
    }

    public boolean cancel(JobCategory category, String entityId) {
        return cancelAll(List.of(category), entityId) > 0;
    }

    public int cancelGroup(EventGroup group, String entityId) {
        return cancelAll(SchedulePolicyTable.categories(group), entityId);
    }

    /**
     * pending 작업을 키별로 취소한다. 이미 실행 중이거나 없는 작업은 false 로 끝나며 정상이다.
     *
     * @return 실제로 제거된 작업 수
     */
    public int cancelAll(Collection<JobCategory> categories, String entityId) {
        requireEntityId(entityId);
        if (!queue.isAvailable()) {
            log.warn("[Scheduler] broker not configured, skipped cancel categories={}, entityId={}", categories, entityId);
            return 0;
        }

        int cancelled = 0;
        for (JobCategory category : categories) {
            String key = JobKey.of(category, entityId);
            try {
                if (queue.cancel(key)) cancelled++;
            } catch (RuntimeException e) {
                log.warn("[Scheduler] cancel failed key={}, err={}", key, e.toString());
            }
        }
        if (cancelled > 0) metrics.incCancelled(cancelled);
        return cancelled;
    }

    private CompletableFuture<EnqueueOutcome> enqueueAsync(JobCategory category, JobPayload payload, long delay) {
        String key = JobKey.of(category, payload.entityId());
        try {
            return CompletableFuture
                    .supplyAsync(() -> {
                        queue.enqueue(key, payload, delay);
                        metrics.incScheduled();
                        return EnqueueOutcome.enqueued(key, category);
                    }, enqueueExecutor)
                    .exceptionally(e -> enqueueFailed(key, category, e));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(enqueueFailed(key, category, e));
        }
    }

    private EnqueueOutcome enqueueFailed(String key, JobCategory category, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("[Scheduler] enqueue failed key={}, err={}", key, cause.toString());
        metrics.incEnqueueFailed();
        return EnqueueOutcome.failed(key, category);
    }

    private static ScheduleResult collect(String entityId, List<JobCategory> skippedPast,
                                          List<CompletableFuture<EnqueueOutcome>> pending) {
        List<String> enqueued = new ArrayList<>();
        List<JobCategory> failed = new ArrayList<>();
        for (CompletableFuture<EnqueueOutcome> f : pending) {
            EnqueueOutcome o = f.join();
            if (o.ok()) enqueued.add(o.key());
            else failed.add(o.category());
        }
        return new ScheduleResult(entityId, true, enqueued, skippedPast, failed);
    }

    private static void requireEntityId(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
    }

    private record EnqueueOutcome(String key, JobCategory category, boolean ok) {
        static EnqueueOutcome enqueued(String key, JobCategory category) {
            return new EnqueueOutcome(key, category, true);
        }

        static EnqueueOutcome failed(String key, JobCategory category) {
            return new EnqueueOutcome(key, category, false);
        }
    }
}
