package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.repository.JobEventLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 완료 기록은 7일/최대 1000건, 실패 기록은 30일만 보관한다.
 */
@Slf4j
@Component
public class AuditRetentionWorker {

    private final DelayedJobQueue queue;
    private final JobEventLogRepository eventLogRepository;
    private final Clock clock;
    private final int completedDays;
    private final int completedMax;
    private final int failedDays;

    public AuditRetentionWorker(DelayedJobQueue queue,
                                JobEventLogRepository eventLogRepository,
                                Clock clock,
                                @Value("${notifyq.retention.completed-days:7}") int completedDays,
                                @Value("${notifyq.retention.completed-max:1000}") int completedMax,
                                @Value("${notifyq.retention.failed-days:30}") int failedDays) {
        this.queue = queue;
        this.eventLogRepository = eventLogRepository;
        this.clock = clock;
        this.completedDays = completedDays;
        this.completedMax = completedMax;
        this.failedDays = failedDays;
    }

    @Scheduled(fixedDelayString = "${notifyq.retention.cleanup-interval-millis:3600000}")
    public void run() {
        Instant now = clock.instant();
        Instant completedBefore = now.minus(Duration.ofDays(completedDays));
        Instant failedBefore = now.minus(Duration.ofDays(failedDays));

        int purgedJobs = 0;
        if (queue.isAvailable()) {
            try {
                purgedJobs = queue.purgeFinished(completedBefore, completedMax, failedBefore);
            } catch (DataAccessException e) {
                log.warn("[Retention] broker purge failed: {}", e.getMessage());
            }
        }

        int purgedEvents = 0;
        try {
            purgedEvents = eventLogRepository.deleteOlderThan(failedBefore);
        } catch (RuntimeException e) {
            log.warn("[Retention] event log purge failed: {}", e.getMessage());
        }
        log.info("[Retention] purged jobs={}, events={}, completedBefore={}, failedBefore={}",
                purgedJobs, purgedEvents, completedBefore, failedBefore);
    }
}
