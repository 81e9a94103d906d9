package com.yerin.notifyq.service;

import com.yerin.notifyq.domain.*;
import com.yerin.notifyq.global.exception.AppException;
import com.yerin.notifyq.global.exception.code.JobErrorCode;
import com.yerin.notifyq.repository.JobEventLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminJobService {
    private final DelayedJobQueue queue;
    private final JobEventLogRepository eventLogRepository;

    public ScheduledJob find(String key) {
        requireBroker();
        return queue.find(key).orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    public List<JobEventLog> events(String key) {
        return eventLogRepository.findTop100ByJobKeyOrderByTsDesc(key);
    }

    public ScheduledJob replay(String key) {
        ScheduledJob job = find(key);

        if (job.getStatus() != JobStatus.FAILED) {
            throw new AppException(JobErrorCode.JOB_NOT_EXHAUSTED);
        }

        // 시도 횟수를 초기화하고 즉시 재처리
        queue.enqueue(job.getKey(), job.getPayload(), 0);
        log.info("[Admin] replay key={}, previousAttempts={}", key, job.getAttempts());
        return queue.find(key).orElse(job);
    }

    private void requireBroker() {
        if (!queue.isAvailable()) throw new AppException(JobErrorCode.QUEUE_UNAVAILABLE);
    }
}
