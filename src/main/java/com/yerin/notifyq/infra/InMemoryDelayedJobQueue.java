package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 단일 프로세스용 브로커. local-inmem 프로필과 테스트에서 Redis 구현과 같은 의미로 동작한다.
 */
@Slf4j
public class InMemoryDelayedJobQueue implements DelayedJobQueue {

    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Duration leaseDuration;

    private final Map<String, ScheduledJob> pending = new HashMap<>();
    private final Map<String, ScheduledJob> leased = new HashMap<>();
    private final Map<String, ScheduledJob> finished = new HashMap<>();
    private final Map<String, Instant> finishedAt = new HashMap<>();
    private final Map<String, Long> claims = new HashMap<>();
    private long claimSeq;

    public InMemoryDelayedJobQueue(Clock clock, RetryPolicy retryPolicy, Duration leaseDuration) {
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized String enqueue(String key, JobPayload payload, long delayMillis) {
        Instant dueAt = clock.instant().plusMillis(Math.max(0, delayMillis));
        ScheduledJob job = ScheduledJob.builder()
                .key(key)
                .payload(payload)
                .dueAt(dueAt)
                .attempts(0)
                .status(JobStatus.PENDING)
                .build();
        ScheduledJob replaced = pending.put(key, job);
        finished.remove(key);
        finishedAt.remove(key);
        log.debug("[InMemoryQueue] enqueue key={}, dueAt={}, replaced={}", key, dueAt, replaced != null);
        return key;
    }

    @Override
    public synchronized boolean cancel(String key) {
        ScheduledJob removed = pending.remove(key);
        if (removed == null) return false;
        finish(removed.toBuilder().status(JobStatus.CANCELLED).build());
        return true;
    }

    @Override
    public synchronized List<ScheduledJob> pollDue(int max, String consumer) {
        Instant now = clock.instant();
        List<ScheduledJob> due = pending.values().stream()
                .filter(j -> !j.getDueAt().isAfter(now))
                .sorted(Comparator.comparing(ScheduledJob::getDueAt))
                .limit(max)
                .toList();

        List<ScheduledJob> claimed = new ArrayList<>(due.size());
        for (ScheduledJob j : due) {
            pending.remove(j.getKey());
            ScheduledJob running = j.toBuilder()
                    .status(JobStatus.EXECUTING)
                    .attempts(j.getAttempts() + 1)
                    .leaseUntil(now.plus(leaseDuration))
                    .claim(++claimSeq)
                    .build();
            claims.put(j.getKey(), running.getClaim());
            leased.put(j.getKey(), running);
            claimed.add(running);
        }
        return claimed;
    }

    @Override
    public synchronized void complete(ScheduledJob job) {
        if (isStale(job)) {
            log.debug("[InMemoryQueue] complete superseded key={}, claim={}", job.getKey(), job.getClaim());
            return;
        }
        leased.remove(job.getKey());
        if (pending.containsKey(job.getKey())) return;
        finish(job.toBuilder().status(JobStatus.COMPLETED).leaseUntil(null).build());
    }

    @Override
    public synchronized RetryDecision fail(ScheduledJob job, Throwable error) {
        if (isStale(job)) return RetryDecision.SUPERSEDED;
        leased.remove(job.getKey());
        if (pending.containsKey(job.getKey())) return RetryDecision.SUPERSEDED;

        String message = error == null ? null : error.toString();
        if (retryPolicy.isExhausted(job.getAttempts())) {
            finish(job.toBuilder().status(JobStatus.FAILED).leaseUntil(null).lastError(message).build());
            return RetryDecision.EXHAUSTED;
        }
        Instant retryAt = clock.instant().plus(retryPolicy.backoffAfter(job.getAttempts()));
        pending.put(job.getKey(), job.toBuilder()
                .status(JobStatus.PENDING)
                .dueAt(retryAt)
                .leaseUntil(null)
                .lastError(message)
                .build());
        return RetryDecision.RETRY_SCHEDULED;
    }

    @Override
    public synchronized List<ScheduledJob> requeueExpiredLeases() {
        Instant now = clock.instant();
        List<ScheduledJob> exhausted = new ArrayList<>();
        Iterator<ScheduledJob> it = leased.values().iterator();
        while (it.hasNext()) {
            ScheduledJob j = it.next();
            if (j.getLeaseUntil() == null || j.getLeaseUntil().isAfter(now)) continue;
            it.remove();
            if (pending.containsKey(j.getKey())) continue;
            if (retryPolicy.isExhausted(j.getAttempts())) {
                ScheduledJob failed = j.toBuilder().status(JobStatus.FAILED).leaseUntil(null).lastError("lease expired").build();
                finish(failed);
                exhausted.add(failed);
            } else {
                pending.put(j.getKey(), j.toBuilder().status(JobStatus.PENDING).dueAt(now).leaseUntil(null).build());
            }
        }
        return exhausted;
    }

    @Override
    public synchronized int purgeFinished(Instant completedBefore, int completedMax, Instant failedBefore) {
        List<String> removable = new ArrayList<>();
        List<String> completedByAge = new ArrayList<>();
        for (ScheduledJob j : finished.values()) {
            Instant at = finishedAt.get(j.getKey());
            Instant cutoff = j.getStatus() == JobStatus.FAILED ? failedBefore : completedBefore;
            if (at.isBefore(cutoff)) {
                removable.add(j.getKey());
            } else if (j.getStatus() != JobStatus.FAILED) {
                completedByAge.add(j.getKey());
            }
        }
        if (completedByAge.size() > completedMax) {
            completedByAge.sort(Comparator.comparing(finishedAt::get));
            removable.addAll(completedByAge.subList(0, completedByAge.size() - completedMax));
        }
        for (String key : removable) {
            finished.remove(key);
            finishedAt.remove(key);
            claims.remove(key);
        }
        return removable.size();
    }

    @Override
    public synchronized Optional<ScheduledJob> find(String key) {
        if (pending.containsKey(key)) return Optional.of(pending.get(key));
        if (leased.containsKey(key)) return Optional.of(leased.get(key));
        return Optional.ofNullable(finished.get(key));
    }

    @Override
    public synchronized long pendingCount() {
        return pending.size();
    }

    // 같은 키를 그 뒤에 다른 전달이 가져갔으면 이 전달의 결과는 버린다
    private boolean isStale(ScheduledJob job) {
        return !Objects.equals(claims.get(job.getKey()), job.getClaim());
    }

    private void finish(ScheduledJob job) {
        finished.put(job.getKey(), job);
        finishedAt.put(job.getKey(), clock.instant());
    }
}
