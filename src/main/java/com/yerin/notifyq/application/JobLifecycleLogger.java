package com.yerin.notifyq.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notifyq.domain.JobEventLog;
import com.yerin.notifyq.domain.ScheduledJob;
import com.yerin.notifyq.repository.JobEventLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업 수명주기 이벤트를 한 줄 JSON 로그로 남기고 notification_job_event 에 적재한다.
 */
@Slf4j
@Component
public class JobLifecycleLogger {

    public static final String EXHAUSTED_EVENT = "job_exhausted_retries";

    private static final Logger EVENTS = LoggerFactory.getLogger("notifyq.job-lifecycle");

    private final ObjectMapper objectMapper;
    private final JobEventLogRepository eventLogRepository;
    private final Clock clock;

    public JobLifecycleLogger(ObjectMapper objectMapper, JobEventLogRepository eventLogRepository, Clock clock) {
        this.objectMapper = objectMapper;
        this.eventLogRepository = eventLogRepository;
        this.clock = clock;
    }

    public void started(ScheduledJob job) {
        emit(job, "started", null, null, null);
    }

    public void skipped(ScheduledJob job, String reason, long durationMs) {
        emit(job, "skipped", durationMs, "reason", reason);
    }

    public void completed(ScheduledJob job, long durationMs) {
        emit(job, "completed", durationMs, null, null);
    }

    public void failed(ScheduledJob job, long durationMs, Throwable error) {
        emit(job, "failed", durationMs, "error", String.valueOf(error));
    }

    public void exhausted(ScheduledJob job, Throwable lastError) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("event", EXHAUSTED_EVENT);
        e.put("timestamp", clock.instant().toString());
        e.put("jobId", job.getKey());
        e.put("category", job.category());
        e.put("entityId", job.entityId());
        e.put("fundId", job.fundId());
        e.put("attempts", job.getAttempts());
        String error = lastError != null ? lastError.toString() : job.getLastError();
        e.put("error", error);

        EVENTS.error(toJson(e));
        persist(job, EXHAUSTED_EVENT, null, error);
    }

    private void emit(ScheduledJob job, String status, Long durationMs, String detailName, String detail) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("timestamp", clock.instant().toString());
        e.put("jobId", job.getKey());
        e.put("category", job.category());
        e.put("entityId", job.entityId());
        e.put("fundId", job.fundId());
        e.put("status", status);
        e.put("attempt", job.getAttempts());
        if (durationMs != null) e.put("durationMs", durationMs);
        if (detailName != null) e.put(detailName, detail);

        if ("failed".equals(status)) {
            EVENTS.error(toJson(e));
        } else {
            EVENTS.info(toJson(e));
        }
        persist(job, status, durationMs, detail);
    }

    private String toJson(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("[Lifecycle] json render failed: {}", ex.getOriginalMessage());
            return event.toString();
        }
    }

    // 감사 테이블 적재 실패가 작업 처리 결과를 바꾸면 안 된다.
    // DB 장애 시 save 는 DataAccessException 이 아닌 TransactionException 도 던진다.
    private void persist(ScheduledJob job, String eventType, Long durationMs, String message) {
        try {
            eventLogRepository.save(JobEventLog.builder()
                    .jobKey(job.getKey())
                    .category(job.category())
                    .entityId(job.entityId())
                    .fundId(job.fundId())
                    .eventType(eventType)
                    .durationMs(durationMs)
                    .message(message)
                    .ts(clock.instant())
                    .build());
        } catch (RuntimeException ex) {
            log.warn("[Lifecycle] event persist failed key={}, event={}, err={}", job.getKey(), eventType, ex.getMessage());
        }
    }
}
